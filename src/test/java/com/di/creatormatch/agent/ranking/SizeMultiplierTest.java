package com.di.creatormatch.agent.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SizeMultiplier Tests")
class SizeMultiplierTest {

    private final ScoringProperties properties = new ScoringProperties();

    @ParameterizedTest(name = "followers={0} range=[{1},{2}] -> {3}")
    @CsvSource({
            ",        10000, 100000, 0.35",
            "0,       10000, 100000, 0.35",
            "50000,   10000, 100000, 1.0",
            "8000,    10000, 100000, 0.8",
            "1000,    10000, 100000, 0.5",
            "200000,  10000, 100000, 0.5",
            "1000000, 10000, 100000, 0.3",
            "9000000, ,      ,       1.0"
    })
    void testOf(Long followers, Long min, Long max, double expected) {
        assertEquals(expected, SizeMultiplier.of(followers, min, max, properties), 1e-9);
    }
}
