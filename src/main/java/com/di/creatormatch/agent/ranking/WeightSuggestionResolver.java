package com.di.creatormatch.agent.ranking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns parser weight suggestions into validated {@link RankingWeights}.
 * <ul>
 *   <li>suggestions are laid over the base weights; unknown keys and non-finite values are ignored;</li>
 *   <li>a suggestion closer to uniform than the variance threshold carries no information and is dropped;</li>
 *   <li>factors with a zero base weight stay at zero;</li>
 *   <li>niche match never ends below its base weight;</li>
 *   <li>the result sums to 1.0.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeightSuggestionResolver {

    private final ScoringProperties properties;

    public RankingWeights resolve(Map<String, Double> suggestions) {
        RankingWeights base = properties.baseWeights();
        if (suggestions == null || suggestions.isEmpty()) return base;

        Map<RankingFactor, Double> merged = new EnumMap<>(base.asMap());
        int applied = 0;
        for (Map.Entry<String, Double> e : suggestions.entrySet()) {
            Optional<RankingFactor> factor = RankingFactor.fromKey(e.getKey());
            Double value = e.getValue();
            if (factor.isEmpty() || value == null || value.isNaN() || value.isInfinite()) {
                log.debug("[RANK] Ignoring weight suggestion {}={}", e.getKey(), value);
                continue;
            }
            merged.put(factor.get(), Math.max(0.0, value));
            applied++;
        }
        if (applied == 0) return base;

        double variance = variance(merged);
        if (variance < properties.getSuggestionVarianceThreshold()) {
            log.info("[RANK] Discarding near-uniform weight suggestion (variance={})", String.format("%.5f", variance));
            return base;
        }

        for (RankingFactor f : RankingFactor.values()) {
            if (base.get(f) == 0.0) merged.put(f, 0.0);
        }

        RankingWeights resolved = withNicheFloor(merged, base.get(RankingFactor.NICHE_MATCH));
        log.debug("[RANK] Resolved weights {}", resolved);
        return resolved;
    }

    /** Normalizes to 1.0 while keeping niche match at or above {@code nicheFloor}. */
    static RankingWeights withNicheFloor(Map<RankingFactor, Double> raw, double nicheFloor) {
        RankingWeights scaled = RankingWeights.normalized(raw);
        double niche = scaled.get(RankingFactor.NICHE_MATCH);
        if (niche >= nicheFloor) return scaled;

        double others = 1.0 - niche;
        Map<RankingFactor, Double> out = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) {
            out.put(f, f == RankingFactor.NICHE_MATCH
                    ? nicheFloor
                    : scaled.get(f) / others * (1.0 - nicheFloor));
        }
        return new RankingWeights(out);
    }

    /** Variance of the weights after scaling them to sum to 1.0. */
    static double variance(Map<RankingFactor, Double> weights) {
        int n = weights.size();
        double total = 0.0;
        for (double w : weights.values()) total += w;
        if (n == 0 || total <= 0) return 0.0;
        double mean = 1.0 / n;
        double sq = 0.0;
        for (double w : weights.values()) sq += (w / total - mean) * (w / total - mean);
        return sq / n;
    }
}
