package com.di.creatormatch.agent.intelligence;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Locations of the static reference data.
 *
 * <pre>
 * creatormatch:
 *   intelligence:
 *     niche-taxonomy: data/niche_taxonomy.yaml
 *     brand-intelligence: data/brand_intelligence.yaml
 *     min-niche-confidence: 0.5
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.intelligence")
public class IntelligenceProperties {

    /** Classpath location of the niche taxonomy YAML. */
    private String nicheTaxonomy = "data/niche_taxonomy.yaml";

    /** Classpath location of the brand graph YAML. */
    private String brandIntelligence = "data/brand_intelligence.yaml";

    /**
     * A stored primary niche is trusted over keyword detection when its confidence is at least this.
     * A stored niche without confidence is trusted.
     */
    private double minNicheConfidence = 0.5;
}
