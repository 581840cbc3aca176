package com.di.creatormatch.agent.intelligence;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Loads the bundled reference data once for tests across packages.
 */
public final class IntelligenceFixtures {

    private static NicheTaxonomy taxonomy;
    private static BrandIntelligenceGraph brands;

    private IntelligenceFixtures() {
    }

    public static synchronized NicheTaxonomy taxonomy() {
        if (taxonomy == null) {
            taxonomy = new NicheTaxonomy(load("data/niche_taxonomy.yaml", NicheTaxonomy.Document.class));
        }
        return taxonomy;
    }

    public static synchronized BrandIntelligenceGraph brands() {
        if (brands == null) {
            brands = new BrandIntelligenceGraph(load("data/brand_intelligence.yaml", BrandIntelligenceGraph.Document.class));
        }
        return brands;
    }

    public static BrandIntelligenceService service() {
        return new BrandIntelligenceService(taxonomy(), brands(), new IntelligenceProperties());
    }

    private static <T> T load(String location, Class<T> type) {
        try {
            return ReferenceDataConfig.read(location, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
