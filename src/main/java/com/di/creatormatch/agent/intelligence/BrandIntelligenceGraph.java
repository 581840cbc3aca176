package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only brand graph: competitors, handles and known ambassadors per brand, indexed by handle
 * and by ambassador username.
 */
public class BrandIntelligenceGraph {

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Document {
        private Map<String, BrandDefinition> brands = new LinkedHashMap<>();
    }

    /** A brand a creator represents, with the relationship details. */
    public static final class Ambassadorship {
        private final String brandKey;
        private final BrandDefinition.Ambassador ambassador;

        Ambassadorship(String brandKey, BrandDefinition.Ambassador ambassador) {
            this.brandKey = brandKey;
            this.ambassador = ambassador;
        }

        public String getBrandKey() {
            return brandKey;
        }

        public String getRelationship() {
            return ambassador.getRelationship() != null ? ambassador.getRelationship() : "ambassador";
        }

        public boolean isActive() {
            return ambassador.getStatus() == null || !"former".equalsIgnoreCase(ambassador.getStatus());
        }

        public String getSince() {
            return ambassador.getSince();
        }
    }

    private final Map<String, BrandDefinition> brands;
    private final Map<String, String> handleToKey = new LinkedHashMap<>();
    private final Map<String, List<Ambassadorship>> byUsername = new LinkedHashMap<>();

    public BrandIntelligenceGraph(Document document) {
        Map<String, BrandDefinition> lowered = new LinkedHashMap<>();
        if (document != null && document.getBrands() != null) {
            document.getBrands().forEach((k, v) -> lowered.put(normalize(k), v != null ? v : new BrandDefinition()));
        }
        this.brands = Collections.unmodifiableMap(lowered);
        brands.forEach((key, def) -> {
            for (String handle : def.getInstagramHandles()) {
                if (handle != null) handleToKey.putIfAbsent(normalize(handle), key);
            }
            for (BrandDefinition.Ambassador a : def.getAmbassadors()) {
                if (a != null && a.getUsername() != null && !a.getUsername().isBlank()) {
                    byUsername.computeIfAbsent(normalize(a.getUsername()), u -> new ArrayList<>())
                            .add(new Ambassadorship(key, a));
                }
            }
        });
    }

    public static BrandIntelligenceGraph empty() {
        return new BrandIntelligenceGraph(new Document());
    }

    public int size() {
        return brands.size();
    }

    /** Resolves a brand key or Instagram handle ({@code @} optional) to the brand key. */
    public Optional<String> resolveKey(String keyOrHandle) {
        if (keyOrHandle == null || keyOrHandle.isBlank()) return Optional.empty();
        String k = normalize(keyOrHandle);
        if (brands.containsKey(k)) return Optional.of(k);
        return Optional.ofNullable(handleToKey.get(k));
    }

    public Optional<BrandDefinition> find(String keyOrHandle) {
        return resolveKey(keyOrHandle).map(brands::get);
    }

    public String displayName(String brandKey) {
        BrandDefinition def = brands.get(brandKey);
        return def != null && def.getName() != null ? def.getName() : brandKey;
    }

    public Set<String> competitorKeys(String keyOrHandle) {
        Set<String> out = new LinkedHashSet<>();
        find(keyOrHandle).ifPresent(def -> def.getCompetitors().forEach(c -> out.add(normalize(c))));
        return out;
    }

    public Set<String> competitorHandles(String keyOrHandle) {
        Set<String> out = new LinkedHashSet<>();
        for (String key : competitorKeys(keyOrHandle)) {
            BrandDefinition def = brands.get(key);
            if (def != null) def.getInstagramHandles().forEach(h -> out.add(normalize(h)));
        }
        return out;
    }

    /** Handles and key of the brand itself. */
    public Set<String> ownHandles(String keyOrHandle) {
        Set<String> out = new LinkedHashSet<>();
        resolveKey(keyOrHandle).ifPresent(key -> {
            out.add(key);
            brands.get(key).getInstagramHandles().forEach(h -> out.add(normalize(h)));
        });
        return out;
    }

    public List<Ambassadorship> ambassadorships(String username) {
        if (username == null) return List.of();
        return byUsername.getOrDefault(normalize(username), List.of());
    }

    static String normalize(String handle) {
        String h = handle.trim().toLowerCase(Locale.ROOT);
        while (h.startsWith("@")) h = h.substring(1);
        return h;
    }
}
