package com.di.creatormatch.agent.ranking;

import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/** The eight sub-scores of one candidate, each in [0, 1]. */
@Value
@Builder
public class ScoreBreakdown {
    double credibility;
    double engagement;
    double audienceMatch;
    double growth;
    double geography;
    double brandAffinity;
    double creativeFit;
    double nicheMatch;

    public double get(RankingFactor factor) {
        switch (factor) {
            case CREDIBILITY:
                return credibility;
            case ENGAGEMENT:
                return engagement;
            case AUDIENCE_MATCH:
                return audienceMatch;
            case GROWTH:
                return growth;
            case GEOGRAPHY:
                return geography;
            case BRAND_AFFINITY:
                return brandAffinity;
            case CREATIVE_FIT:
                return creativeFit;
            case NICHE_MATCH:
                return nicheMatch;
            default:
                throw new IllegalArgumentException("Unknown factor " + factor);
        }
    }

    /** Weighted sum before the size multiplier. */
    public double weightedSum(RankingWeights weights) {
        double sum = 0.0;
        for (RankingFactor f : RankingFactor.values()) {
            sum += weights.get(f) * get(f);
        }
        return sum;
    }

    public Map<RankingFactor, Double> asMap() {
        Map<RankingFactor, Double> map = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) map.put(f, get(f));
        return map;
    }
}
