package com.di.creatormatch.agent.ranking;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ranking constants.
 * <pre>
 * creatormatch:
 *   scoring:
 *     weights:
 *       engagement: 0.20
 *       credibility: 0.15
 *       ...
 *     unknown-followers-multiplier: 0.35
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.scoring")
public class ScoringProperties {

    // ------------------------------------------------------------------ //
    // Weights                                                             //
    // ------------------------------------------------------------------ //

    /** Base weights keyed by factor key; missing factors take the built-in default. */
    private Map<String, Double> weights = new LinkedHashMap<>();

    /** Suggestions whose weights are closer to uniform than this are ignored. */
    private double suggestionVarianceThreshold = 0.001;

    // ------------------------------------------------------------------ //
    // Sub-score scales                                                    //
    // ------------------------------------------------------------------ //

    /** Engagement (fraction) that earns a full engagement score. */
    private double engagementCeiling = 0.15;
    private double growthOffset = 0.20;
    private double growthSpan = 0.70;

    // ------------------------------------------------------------------ //
    // Size multiplier                                                     //
    // ------------------------------------------------------------------ //

    private double belowRangeFloor = 0.5;
    private double aboveRangeFloor = 0.3;
    private double unknownFollowersMultiplier = 0.35;

    /** Configured base weights, or the built-in defaults when none are configured. */
    public RankingWeights baseWeights() {
        if (weights == null || weights.isEmpty()) return RankingWeights.defaults();
        Map<RankingFactor, Double> map = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) map.put(f, f.getDefaultWeight());
        weights.forEach((k, v) -> RankingFactor.fromKey(k).ifPresent(f -> map.put(f, v)));
        return new RankingWeights(map);
    }
}
