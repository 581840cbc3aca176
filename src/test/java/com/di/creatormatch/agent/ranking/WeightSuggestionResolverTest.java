package com.di.creatormatch.agent.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeightSuggestionResolver Tests")
class WeightSuggestionResolverTest {

    private final ScoringProperties properties = new ScoringProperties();
    private final WeightSuggestionResolver resolver = new WeightSuggestionResolver(properties);

    private static double sum(RankingWeights w) {
        return w.asMap().values().stream().mapToDouble(Double::doubleValue).sum();
    }

    // ============================================================================
    // Fallback to base weights
    // ============================================================================

    @Test
    @DisplayName("No suggestions returns the base weights")
    void testResolve_NoSuggestions() {
        assertEquals(RankingWeights.defaults(), resolver.resolve(null));
        assertEquals(RankingWeights.defaults(), resolver.resolve(Map.of()));
    }

    @Test
    @DisplayName("Unknown keys and non-finite values are ignored")
    void testResolve_IgnoredKeys() {
        Map<String, Double> suggestions = new HashMap<>();
        suggestions.put("charisma", 0.9);
        suggestions.put("engagement", Double.NaN);
        assertEquals(RankingWeights.defaults(), resolver.resolve(suggestions));
    }

    @Test
    @DisplayName("Near-uniform suggestion carries no signal and is discarded")
    void testResolve_UniformDiscarded() {
        Map<String, Double> uniform = new HashMap<>();
        for (RankingFactor f : RankingFactor.values()) uniform.put(f.getKey(), 0.125);
        assertEquals(RankingWeights.defaults(), resolver.resolve(uniform));
    }

    // ============================================================================
    // Applied suggestions
    // ============================================================================

    @Test
    @DisplayName("Suggestion overrides a factor and the result sums to 1.0")
    void testResolve_Override() {
        RankingWeights w = resolver.resolve(Map.of("engagement", 0.5));

        assertEquals(1.0, sum(w), RankingWeights.SUM_TOLERANCE);
        assertEquals(0.38, w.get(RankingFactor.ENGAGEMENT), 1e-9);
        assertEquals(0.05, w.get(RankingFactor.NICHE_MATCH), 1e-9, "niche match floored at its base weight");
        assertTrue(w.get(RankingFactor.ENGAGEMENT) > w.get(RankingFactor.CREDIBILITY));
    }

    @Test
    @DisplayName("Key spelling variants resolve to the same factor")
    void testResolve_KeyVariants() {
        RankingWeights snake = resolver.resolve(Map.of("niche_match", 0.5));
        RankingWeights camel = resolver.resolve(Map.of("nicheMatch", 0.5));
        RankingWeights dashed = resolver.resolve(Map.of("niche-match", 0.5));

        assertEquals(snake, camel);
        assertEquals(snake, dashed);
        assertEquals(0.5 / 1.45, snake.get(RankingFactor.NICHE_MATCH), 1e-9);
    }

    @Test
    @DisplayName("Negative suggestions clamp to zero")
    void testResolve_NegativeClamped() {
        RankingWeights w = resolver.resolve(Map.of("growth", -0.4, "credibility", 0.6));
        assertEquals(0.0, w.get(RankingFactor.GROWTH));
        assertEquals(1.0, sum(w), RankingWeights.SUM_TOLERANCE);
    }

    @Test
    @DisplayName("Configured zero weight stays zero")
    void testResolve_ZeroBaseStaysZero() {
        properties.getWeights().put("growth", 0.0);
        properties.getWeights().put("engagement", 0.25);

        RankingWeights w = resolver.resolve(Map.of("growth", 0.6));

        assertEquals(0.0, w.get(RankingFactor.GROWTH));
        assertEquals(1.0, sum(w), RankingWeights.SUM_TOLERANCE);
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    @Test
    @DisplayName("Variance is zero for uniform weights regardless of scale")
    void testVariance() {
        Map<RankingFactor, Double> uniform = new EnumMap<>(RankingFactor.class);
        for (RankingFactor f : RankingFactor.values()) uniform.put(f, 3.0);
        assertEquals(0.0, WeightSuggestionResolver.variance(uniform), 1e-12);
        assertTrue(WeightSuggestionResolver.variance(RankingWeights.defaults().asMap()) > 0.0);
    }

    @Test
    @DisplayName("Niche floor lifts niche share and rescales the rest")
    void testWithNicheFloor() {
        Map<RankingFactor, Double> raw = new EnumMap<>(RankingWeights.defaults().asMap());
        raw.put(RankingFactor.NICHE_MATCH, 0.0);

        RankingWeights w = WeightSuggestionResolver.withNicheFloor(raw, 0.05);

        assertEquals(0.05, w.get(RankingFactor.NICHE_MATCH), 1e-9);
        assertEquals(1.0, sum(w), RankingWeights.SUM_TOLERANCE);
    }

    @Test
    @DisplayName("Niche floor keeps already-high niche weight and falls back to defaults when nothing is positive")
    void testWithNicheFloor_NormalizedInput() {
        Map<RankingFactor, Double> raw = new EnumMap<>(RankingFactor.class);
        raw.put(RankingFactor.NICHE_MATCH, 1.0);
        raw.put(RankingFactor.ENGAGEMENT, 3.0);

        RankingWeights w = WeightSuggestionResolver.withNicheFloor(raw, 0.05);

        assertEquals(0.25, w.get(RankingFactor.NICHE_MATCH), 1e-9);
        assertEquals(0.75, w.get(RankingFactor.ENGAGEMENT), 1e-9);
        assertEquals(RankingWeights.defaults(),
                WeightSuggestionResolver.withNicheFloor(new EnumMap<>(RankingFactor.class), 0.05));
    }
}
