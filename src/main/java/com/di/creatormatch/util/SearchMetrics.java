package com.di.creatormatch.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for search runs: searches, verification outcomes, external calls,
 * filter rejections and per-stage durations.
 */
@Slf4j
@Component
public class SearchMetrics {

    private final MeterRegistry meterRegistry;

    // Search Metrics
    private final Counter searchCounter;
    private final Counter degradedSearchCounter;
    private final Timer searchTimer;
    private final DistributionSummary resultCountDistribution;

    // Verification Metrics
    private final DistributionSummary externalCallsDistribution;
    private final Counter cacheHitCounter;

    public SearchMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.searchCounter = Counter.builder("creatormatch.search.total")
                .description("Total number of search runs")
                .tag("mode", "normal")
                .register(meterRegistry);

        this.degradedSearchCounter = Counter.builder("creatormatch.search.total")
                .description("Search runs that fell back to lenient-only filtering")
                .tag("mode", "degraded")
                .register(meterRegistry);

        this.searchTimer = Timer.builder("creatormatch.search.duration")
                .description("End-to-end search duration")
                .register(meterRegistry);

        this.resultCountDistribution = DistributionSummary.builder("creatormatch.search.results")
                .description("Number of ranked results returned per search")
                .register(meterRegistry);

        this.externalCallsDistribution = DistributionSummary.builder("creatormatch.verification.external.calls")
                .description("External metrics calls issued per search")
                .baseUnit("calls")
                .register(meterRegistry);

        this.cacheHitCounter = Counter.builder("creatormatch.verification.cache.hits")
                .description("Candidates verified from fresh cached metrics")
                .register(meterRegistry);
    }

    // ============================================================================
    // Search Metrics
    // ============================================================================

    /**
     * Records a finished search.
     *
     * @param durationMs  end-to-end time in milliseconds
     * @param resultCount number of ranked results returned
     * @param degraded    true when verification was unavailable and lenient fallback was used
     */
    public void recordSearch(long durationMs, int resultCount, boolean degraded) {
        if (degraded) {
            degradedSearchCounter.increment();
        } else {
            searchCounter.increment();
        }
        searchTimer.record(durationMs, TimeUnit.MILLISECONDS);
        resultCountDistribution.record(resultCount);
        log.debug("Recorded search: durationMs={}, results={}, degraded={}", durationMs, resultCount, degraded);
    }

    // ============================================================================
    // Verification Metrics
    // ============================================================================

    /** Records verification outcomes (verified, failed, skipped) for one search. */
    public void recordVerification(String outcome, int count) {
        if (count <= 0) return;
        meterRegistry.counter("creatormatch.verification.outcomes", "outcome", outcome).increment(count);
    }

    public void recordVerificationFailure(String category, int count) {
        if (count <= 0) return;
        meterRegistry.counter("creatormatch.verification.failures", "category", category).increment(count);
    }

    public void recordExternalCalls(int calls) {
        externalCallsDistribution.record(calls);
    }

    public void recordCacheHits(int hits) {
        cacheHitCounter.increment(hits);
    }

    // ============================================================================
    // Filter / Stage Metrics
    // ============================================================================

    public void recordRejection(String reason, long count) {
        if (count <= 0) return;
        meterRegistry.counter("creatormatch.filter.rejections", "reason", reason).increment(count);
    }

    public void recordStage(String stage, long durationNanos, boolean success) {
        Timer.builder("creatormatch.stage.duration")
                .description("Duration of one pipeline stage")
                .tag("stage", stage)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
