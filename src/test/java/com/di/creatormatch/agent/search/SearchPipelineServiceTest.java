package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.campaign.GenderSplit;
import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.creator.VerificationState;
import com.di.creatormatch.agent.filter.CreatorGenderInference;
import com.di.creatormatch.agent.filter.FilterEngine;
import com.di.creatormatch.agent.filter.RejectionReason;
import com.di.creatormatch.agent.gateway.MetricsGateway;
import com.di.creatormatch.agent.gateway.RetryPolicy;
import com.di.creatormatch.agent.intelligence.BrandIntelligenceService;
import com.di.creatormatch.agent.intelligence.IntelligenceFixtures;
import com.di.creatormatch.agent.prefilter.PreFilterProperties;
import com.di.creatormatch.agent.prefilter.PreFilterScorer;
import com.di.creatormatch.agent.ranking.RankedResult;
import com.di.creatormatch.agent.ranking.RankingEngine;
import com.di.creatormatch.agent.ranking.ScoringProperties;
import com.di.creatormatch.agent.ranking.WeightSuggestionResolver;
import com.di.creatormatch.agent.store.CandidateStore;
import com.di.creatormatch.agent.store.InMemoryCandidateStore;
import com.di.creatormatch.agent.verification.FakeMetricsProvider;
import com.di.creatormatch.agent.verification.VerificationGate;
import com.di.creatormatch.aspect.ErrorCategory;
import com.di.creatormatch.util.SearchMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchPipelineService Tests")
class SearchPipelineServiceTest {

    private final Clock clock = Clock.systemUTC();
    private final BrandIntelligenceService intelligence = IntelligenceFixtures.service();

    private InMemoryCandidateStore store;
    private FakeMetricsProvider provider;
    private SimpleMeterRegistry registry;
    private SearchPipelineService service;

    private static final CampaignQuery PADEL = CampaignQuery.builder()
            .campaignNiche("padel")
            .targetCount(3)
            .build();

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        provider = new FakeMetricsProvider();
        registry = new SimpleMeterRegistry();
        seed(store);
        service = pipeline(store);
    }

    private SearchPipelineService pipeline(CandidateStore candidateStore) {
        MetricsGateway gateway = new MetricsGateway(provider, RetryPolicy.defaults(), d -> { }, () -> 0.5, 10);
        ScoringProperties scoring = new ScoringProperties();
        return new SearchPipelineService(
                new CandidateDiscovery(candidateStore),
                new PreFilterScorer(intelligence, new PreFilterProperties(), clock, Duration.ofHours(24)),
                new VerificationGate(gateway, candidateStore, clock, Duration.ofHours(24), 5),
                new FilterEngine(intelligence, new CreatorGenderInference()),
                new RankingEngine(intelligence, new WeightSuggestionResolver(scoring), scoring),
                new PipelineProperties(),
                new SearchMetrics(registry),
                clock);
    }

    private static void seed(InMemoryCandidateStore store) {
        store.save(creator("p1", "martapadel", 84_000L, "padel", 88, 74));
        store.save(creator("p2", "javi_padelpro", 215_000L, "padel", 82, 69));
        store.save(creator("p3", "irene.padel", 23_000L, "padel", 87, 90));
        store.save(creator("f1", "cristiano", 640_000_000L, "football", 71, 4));
        store.save(creator("g1", "sergiogaming", 260_000L, "gaming", 69, 72));
        store.save(creator("t1", "carlos.tenis", 98_000L, "tennis", 84, 71));
        store.save(creator("w1", "ana_wellness", 38_000L, "wellness", 93, 88));
    }

    private static CreatorRecord creator(String id, String username, long followers, String niche,
                                         double credibility, double spainPct) {
        return CreatorRecord.builder()
                .id(id)
                .platform(Platform.INSTAGRAM)
                .username(username)
                .followers(followers)
                .primaryNiche(niche)
                .interests(List.of(niche))
                .country("ES")
                .metrics(CreatorMetrics.builder()
                        .credibilityScore(credibility)
                        .engagementRate(0.04)
                        .audienceGeography(Map.of("ES", spainPct))
                        .build())
                .build();
    }

    private static List<String> ids(SearchOutcome outcome) {
        return outcome.getResults().stream().map(r -> r.getCreator().getId()).collect(Collectors.toList());
    }

    private int providerCalls() {
        return provider.lookupCalls.get() + provider.detailCalls.get();
    }

    // ============================================================================
    // Result shape
    // ============================================================================

    @Test
    @DisplayName("Returns at most the target count, sorted by relevance with 1-based positions")
    void testRunSearch_TargetCountAndOrder() {
        SearchOutcome outcome = service.runSearch(PADEL, 200, 15);

        List<RankedResult> results = outcome.getResults();
        assertEquals(3, results.size());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i + 1, results.get(i).getRankPosition());
            if (i > 0) {
                assertTrue(results.get(i - 1).getRelevanceScore() >= results.get(i).getRelevanceScore());
            }
        }
        assertEquals(List.of("p1", "p2", "p3"), ids(outcome).stream().sorted().collect(Collectors.toList()),
                "padel creators outrank everyone else");
        assertNotNull(outcome.getSearchId());
        assertNull(outcome.getStats().getErrorCategory());
    }

    @Test
    @DisplayName("Funnel counts describe the run")
    void testRunSearch_Stats() {
        VerificationStats stats = service.runSearch(PADEL, 200, 15).getStats();

        assertEquals(7, stats.getTotalCandidates());
        assertEquals(7, stats.getPreFiltered());
        assertEquals(7, stats.getVerified());
        assertEquals(14, stats.getExternalCalls());
        assertFalse(stats.isLenientFallback());
        assertEquals(7, stats.getPassedFilters());
    }

    @Test
    @DisplayName("Pool size bounds discovery")
    void testRunSearch_PoolSize() {
        VerificationStats stats = service.runSearch(PADEL, 2, 15).getStats();
        assertEquals(2, stats.getTotalCandidates());
    }

    // ============================================================================
    // Verification budget and cache
    // ============================================================================

    @Test
    @DisplayName("External calls never exceed the verification cap")
    void testRunSearch_VerifyCap() {
        SearchOutcome outcome = service.runSearch(PADEL, 200, 5);

        assertTrue(providerCalls() <= 5, "provider calls " + providerCalls());
        assertTrue(outcome.getStats().getExternalCalls() <= 5);
        assertEquals(2, outcome.getStats().getVerified());
        assertEquals(5, outcome.getStats().getBudgetSkipped());
    }

    @Test
    @DisplayName("Zero cap still returns ranked results from local data")
    void testRunSearch_ZeroCap() {
        SearchOutcome outcome = service.runSearch(PADEL, 200, 0);

        assertEquals(0, providerCalls());
        assertFalse(outcome.getResults().isEmpty());
        assertTrue(outcome.getResults().stream()
                .allMatch(r -> r.getVerificationState() == VerificationState.UNVERIFIED));
    }

    @Test
    @DisplayName("Warm runs hit the cache and return identical rankings")
    void testRunSearch_IdempotentWhenWarm() {
        service.runSearch(PADEL, 200, 15);
        int callsAfterFirst = providerCalls();

        SearchOutcome second = service.runSearch(PADEL, 200, 15);
        SearchOutcome third = service.runSearch(PADEL, 200, 15);

        assertEquals(callsAfterFirst, providerCalls(), "warm runs issue no external calls");
        assertEquals(7, second.getStats().getCacheHits());
        assertEquals(ids(second), ids(third));
        for (int i = 0; i < second.getResults().size(); i++) {
            assertEquals(second.getResults().get(i).getRelevanceScore(), third.getResults().get(i).getRelevanceScore());
        }
    }

    // ============================================================================
    // Degradation
    // ============================================================================

    @Test
    @DisplayName("Upstream fully down still yields lenient results with zero verified")
    void testRunSearch_UpstreamDown() {
        provider.failWithStatus = 503;

        SearchOutcome outcome = service.runSearch(PADEL, 200, 15);

        VerificationStats stats = outcome.getStats();
        assertEquals(0, stats.getVerified());
        assertTrue(stats.isLenientFallback());
        assertEquals(7, stats.getFailures().get(ErrorCategory.UPSTREAM_UNAVAILABLE));
        assertFalse(outcome.getResults().isEmpty());
        assertTrue(outcome.getResults().stream().allMatch(r -> r.getWarnings().contains("Metrics not verified")));
        assertFalse(ids(outcome).contains("f1"), "known Spain share below threshold still rejects");
        assertEquals(1.0, registry.counter("creatormatch.search.total", "mode", "degraded").count());
    }

    @Test
    @DisplayName("A failing store is classified and produces an empty outcome")
    void testRunSearch_StoreFailure() {
        InMemoryCandidateStore broken = new InMemoryCandidateStore() {
            @Override
            public List<CreatorRecord> findByNiche(String niche, int limit) {
                throw new DataAccessResourceFailureException("connection refused");
            }
        };

        SearchOutcome outcome = pipeline(broken).runSearch(PADEL, 200, 15);

        assertTrue(outcome.getResults().isEmpty());
        assertEquals(ErrorCategory.DATABASE_ERROR, outcome.getStats().getErrorCategory());
    }

    @Test
    @DisplayName("Empty store gives an empty result, not an error")
    void testRunSearch_EmptyStore() {
        SearchOutcome outcome = pipeline(new InMemoryCandidateStore()).runSearch(PADEL, 200, 15);

        assertTrue(outcome.getResults().isEmpty());
        assertEquals(0, outcome.getStats().getTotalCandidates());
        assertNull(outcome.getStats().getErrorCategory());
    }

    // ============================================================================
    // Hard rules
    // ============================================================================

    @Test
    @DisplayName("Excluded niches never appear, whatever their scores")
    void testRunSearch_HardExclusion() {
        CampaignQuery query = CampaignQuery.builder()
                .targetCount(10)
                .excludeNiche("gaming")
                .excludeNiche("football")
                .build();

        SearchOutcome outcome = service.runSearch(query, 200, 15);

        assertFalse(ids(outcome).contains("g1"));
        assertFalse(ids(outcome).contains("f1"));
        assertEquals(2, outcome.getStats().getRejections().get(RejectionReason.EXCLUDED_NICHE));
        assertEquals(5, outcome.getResults().size());
    }

    @Test
    @DisplayName("Gender split total overrides a smaller target count")
    void testRunSearch_GenderSplitTarget() {
        CampaignQuery query = PADEL.toBuilder()
                .targetCount(1)
                .genderSplit(GenderSplit.builder().femaleCount(2).maleCount(2).build())
                .build();

        assertEquals(4, service.runSearch(query, 200, 15).getResults().size());
    }
}
