package com.di.creatormatch.agent.ranking;

import java.util.Locale;
import java.util.Optional;

/** The eight scored factors, with their default weights (summing to 1.0). */
public enum RankingFactor {
    CREDIBILITY("credibility", 0.15),
    ENGAGEMENT("engagement", 0.20),
    AUDIENCE_MATCH("audience_match", 0.15),
    GROWTH("growth", 0.05),
    GEOGRAPHY("geography", 0.10),
    BRAND_AFFINITY("brand_affinity", 0.15),
    CREATIVE_FIT("creative_fit", 0.15),
    NICHE_MATCH("niche_match", 0.05);

    private final String key;
    private final double defaultWeight;

    RankingFactor(String key, double defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    public String getKey() {
        return key;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    /** Accepts {@code niche_match}, {@code niche-match}, {@code nicheMatch} or {@code NICHE_MATCH}. */
    public static Optional<RankingFactor> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT).replace('-', '_');
        for (RankingFactor f : values()) {
            if (f.key.equals(k)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
