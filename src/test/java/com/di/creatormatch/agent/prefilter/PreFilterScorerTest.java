package com.di.creatormatch.agent.prefilter;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.intelligence.IntelligenceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PreFilterScorer Tests")
class PreFilterScorerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final PreFilterScorer scorer = new PreFilterScorer(IntelligenceFixtures.service(), new PreFilterProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(24));

    private static final CampaignQuery PADEL = CampaignQuery.builder()
            .campaignNiche("padel")
            .preferredFollowerMin(10_000L)
            .preferredFollowerMax(300_000L)
            .build();

    private static CreatorRecord.CreatorRecordBuilder creator(String id, Long followers) {
        return CreatorRecord.builder().id(id).platform(Platform.INSTAGRAM).username(id).followers(followers);
    }

    private static CreatorRecord.CreatorRecordBuilder verified(String id, Long followers, CreatorMetrics metrics) {
        return creator(id, followers).metricsComplete(true).metrics(metrics).verifiedAt(NOW.minus(Duration.ofHours(2)));
    }

    private static CreatorMetrics metrics(double credibility, double engagement, double spainPct) {
        return CreatorMetrics.builder()
                .credibilityScore(credibility)
                .engagementRate(engagement)
                .audienceGeography(Map.of("ES", spainPct))
                .build();
    }

    private static List<String> ids(List<CreatorRecord> records) {
        return records.stream().map(CreatorRecord::getId).collect(Collectors.toList());
    }

    // ============================================================================
    // score
    // ============================================================================

    @Test
    @DisplayName("Complete metrics clearing thresholds plus niche and size bonuses")
    void testScore_AllBonuses() {
        CreatorRecord r = verified("a", 50_000L, metrics(85, 0.04, 70)).primaryNiche("padel").build();
        assertEquals(3.0 + 2.0 + 0.5, scorer.score(r, PADEL), 1e-9);
    }

    @Test
    @DisplayName("Missing metrics earn the exploration bonus")
    void testScore_MissingMetrics() {
        CreatorRecord r = creator("b", 50_000L).build();
        assertEquals(1.5 + 0.5, scorer.score(r, PADEL), 1e-9);
    }

    @Test
    @DisplayName("Complete metrics below threshold earn nothing for metrics")
    void testScore_BelowThreshold() {
        CreatorRecord r = verified("c", 50_000L, metrics(40, 0.04, 70)).build();
        assertEquals(0.5, scorer.score(r, PADEL), 1e-9);
    }

    @Test
    @DisplayName("Stale metrics below threshold earn the exploration bonus")
    void testScore_StaleBelowThreshold() {
        CreatorRecord stale = creator("s", 50_000L).metricsComplete(true).metrics(metrics(40, 0.04, 70))
                .verifiedAt(NOW.minus(Duration.ofDays(400))).build();
        assertEquals(1.5 + 0.5, scorer.score(stale, PADEL), 1e-9);

        CreatorRecord neverVerified = creator("n", 50_000L).metricsComplete(true).metrics(metrics(40, 0.04, 70)).build();
        assertEquals(1.5 + 0.5, scorer.score(neverVerified, PADEL), 1e-9);
    }

    @Test
    @DisplayName("Stale metrics that clear thresholds no longer earn the pass bonus")
    void testScore_StaleClearingThresholds() {
        CreatorRecord stale = creator("t", 50_000L).primaryNiche("padel").metricsComplete(true)
                .metrics(metrics(85, 0.04, 70)).verifiedAt(NOW.minus(Duration.ofHours(25))).build();
        assertEquals(1.5 + 2.0 + 0.5, scorer.score(stale, PADEL), 1e-9);
    }

    @Test
    @DisplayName("Engagement stored as a percentage is compared as a fraction")
    void testClearsThresholds_PercentEngagement() {
        CampaignQuery query = CampaignQuery.builder().minEngagementRate(3.0).build();
        CreatorRecord r = creator("d", 50_000L).metricsComplete(true).metrics(metrics(85, 4.0, 70)).build();
        assertTrue(PreFilterScorer.clearsThresholds(r, query));
    }

    @Test
    @DisplayName("Excluded niche and competitor ambassador are penalized")
    void testScore_Penalties() {
        CampaignQuery query = CampaignQuery.builder()
                .brandHandle("nike")
                .excludeCompetitorAmbassadors(true)
                .excludeNiche("football")
                .build();
        CreatorRecord messi = creator("leomessi", 500_000_000L).primaryNiche("football").build();
        assertEquals(1.5 + 0.5 - 5.0 - 5.0, scorer.score(messi, query), 1e-9);
    }

    // ============================================================================
    // selectTopK
    // ============================================================================

    @Test
    @DisplayName("Keeps the K best in score, followers, id order")
    void testSelectTopK_Order() {
        List<CreatorRecord> pool = new ArrayList<>();
        pool.add(verified("low", 50_000L, metrics(40, 0.04, 70)).build());
        pool.add(creator("b-miss", 20_000L).build());
        pool.add(creator("a-miss", 20_000L).build());
        pool.add(verified("star", 80_000L, metrics(90, 0.05, 75)).primaryNiche("padel").build());
        pool.add(creator("big-miss", 90_000L).build());

        List<CreatorRecord> top = scorer.selectTopK(pool, PADEL, 4);

        assertEquals(List.of("star", "big-miss", "a-miss", "b-miss"), ids(top));
    }

    @Test
    @DisplayName("K larger than the pool returns the whole pool; empty or zero K returns nothing")
    void testSelectTopK_Bounds() {
        List<CreatorRecord> pool = List.of(creator("x", 1_000L).build(), creator("y", 2_000L).build());
        assertEquals(2, scorer.selectTopK(pool, PADEL, 15).size());
        assertTrue(scorer.selectTopK(pool, PADEL, 0).isEmpty());
        assertTrue(scorer.selectTopK(List.of(), PADEL, 15).isEmpty());
    }
}
