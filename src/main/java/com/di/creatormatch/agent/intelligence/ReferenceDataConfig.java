package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the niche taxonomy and brand graph once at start. A missing file yields an empty graph
 * (every lookup neutral) and a warning; a malformed file fails startup.
 */
@Slf4j
@Configuration
public class ReferenceDataConfig {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Bean
    public NicheTaxonomy nicheTaxonomy(IntelligenceProperties properties) throws IOException {
        NicheTaxonomy.Document doc = read(properties.getNicheTaxonomy(), NicheTaxonomy.Document.class);
        NicheTaxonomy taxonomy = doc != null ? new NicheTaxonomy(doc) : NicheTaxonomy.empty();
        log.info("[INTELLIGENCE] Loaded {} niches from {}", taxonomy.size(), properties.getNicheTaxonomy());
        return taxonomy;
    }

    @Bean
    public BrandIntelligenceGraph brandIntelligenceGraph(IntelligenceProperties properties) throws IOException {
        BrandIntelligenceGraph.Document doc = read(properties.getBrandIntelligence(), BrandIntelligenceGraph.Document.class);
        BrandIntelligenceGraph graph = doc != null ? new BrandIntelligenceGraph(doc) : BrandIntelligenceGraph.empty();
        log.info("[INTELLIGENCE] Loaded {} brands from {}", graph.size(), properties.getBrandIntelligence());
        return graph;
    }

    static <T> T read(String location, Class<T> type) throws IOException {
        if (location == null || location.isBlank()) return null;
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("[INTELLIGENCE] Reference data not found: {}", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return YAML.readValue(in, type);
        }
    }
}
