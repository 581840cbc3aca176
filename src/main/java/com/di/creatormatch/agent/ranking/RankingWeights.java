package com.di.creatormatch.agent.ranking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable factor weights for one ranking run. Every factor is present, no weight is negative and the
 * weights sum to 1.0 within {@link #SUM_TOLERANCE}.
 */
public final class RankingWeights {

    public static final double SUM_TOLERANCE = 0.01;

    private static final RankingWeights DEFAULTS;

    static {
        Map<RankingFactor, Double> d = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) d.put(f, f.getDefaultWeight());
        DEFAULTS = new RankingWeights(d);
    }

    private final Map<RankingFactor, Double> weights;

    /**
     * @throws IllegalArgumentException when a factor is missing, a weight is negative or not finite,
     *                                  or the sum is off by more than {@link #SUM_TOLERANCE}
     */
    public RankingWeights(Map<RankingFactor, Double> weights) {
        Map<RankingFactor, Double> copy = new EnumMap<>(RankingFactor.class);
        double sum = 0.0;
        for (RankingFactor f : RankingFactor.values()) {
            Double w = weights.get(f);
            if (w == null) {
                throw new IllegalArgumentException("Missing weight for " + f.getKey());
            }
            if (w < 0 || w.isNaN() || w.isInfinite()) {
                throw new IllegalArgumentException("Invalid weight for " + f.getKey() + ": " + w);
            }
            copy.put(f, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Ranking weights must sum to 1.0, got " + sum);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static RankingWeights defaults() {
        return DEFAULTS;
    }

    /**
     * Scales {@code raw} to sum to 1.0. Falls back to defaults when nothing positive remains.
     */
    public static RankingWeights normalized(Map<RankingFactor, Double> raw) {
        double sum = 0.0;
        for (RankingFactor f : RankingFactor.values()) {
            Double w = raw.get(f);
            if (w != null && w > 0) sum += w;
        }
        if (sum <= 0) return DEFAULTS;
        Map<RankingFactor, Double> out = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) {
            Double w = raw.get(f);
            out.put(f, w != null && w > 0 ? w / sum : 0.0);
        }
        return new RankingWeights(out);
    }

    public double get(RankingFactor factor) {
        return weights.get(factor);
    }

    public Map<RankingFactor, Double> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RankingWeights)) return false;
        return weights.equals(((RankingWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "RankingWeights" + weights;
    }
}
