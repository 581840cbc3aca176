package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.filter.FilterEngine;
import com.di.creatormatch.agent.filter.FilterResult;
import com.di.creatormatch.agent.prefilter.PreFilterScorer;
import com.di.creatormatch.agent.ranking.RankedResult;
import com.di.creatormatch.agent.ranking.RankingEngine;
import com.di.creatormatch.agent.verification.VerificationGate;
import com.di.creatormatch.agent.verification.VerificationResult;
import com.di.creatormatch.aspect.ErrorCategory;
import com.di.creatormatch.util.SearchMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one search: discovery, pre-filter, verification, filtering, ranking.
 * <p>
 * Stages run one after another on the calling thread; only verification fans out. Nothing escapes
 * {@link #runSearch}: a failing stage is classified, logged and reported in the stats, and the search
 * returns whatever it has (possibly nothing).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchPipelineService {

    static final String SEARCH_ID = "searchId";

    private final CandidateDiscovery discovery;
    private final PreFilterScorer preFilter;
    private final VerificationGate verificationGate;
    private final FilterEngine filterEngine;
    private final RankingEngine rankingEngine;
    private final PipelineProperties properties;
    private final SearchMetrics metrics;
    private final Clock clock;

    /** Search with the configured pool size and verification cap. */
    public SearchOutcome runSearch(CampaignQuery query) {
        return runSearch(query, properties.getPoolSize(), properties.getVerifyCap());
    }

    public SearchOutcome runSearch(CampaignQuery query, int poolSize, int verifyCap) {
        String searchId = "search-" + UUID.randomUUID().toString().substring(0, 8);
        String previous = MDC.get(SEARCH_ID);
        MDC.put(SEARCH_ID, searchId);
        long start = System.nanoTime();
        Instant deadline = clock.instant().plusSeconds(properties.getTimeoutSeconds());
        VerificationStats.VerificationStatsBuilder stats = VerificationStats.builder();
        List<RankedResult> results = new ArrayList<>();

        log.info("[SEARCH] Started searchId={} niche={} brand={} targetCount={} poolSize={} verifyCap={} parseConfidence={}",
                searchId, query.getCampaignNiche(), query.getBrandName(), query.effectiveTargetCount(),
                poolSize, verifyCap, query.getParseConfidence());
        boolean degraded = false;
        try {
            List<CreatorRecord> pool = discovery.discover(query, poolSize);
            stats.totalCandidates(pool.size());

            List<CreatorRecord> selected = preFilter.selectTopK(pool, query, properties.getPreFilterK());
            stats.preFiltered(selected.size());

            VerificationResult verification = verify(selected, verifyCap, deadline);
            degraded = verification.isLenientFallback();
            stats.verified(verification.getVerified() + verification.getCacheHits())
                    .failedVerification(verification.getFailed())
                    .cacheHits(verification.getCacheHits())
                    .externalCalls(verification.getExternalCalls())
                    .budgetSkipped(verification.getBudgetSkipped())
                    .lenientFallback(verification.isLenientFallback())
                    .failures(verification.getFailureCategories());
            recordVerification(verification);

            FilterResult filtered = filterEngine.apply(verification.getCandidates(), query);
            stats.passedFilters(filtered.getPassed().size())
                    .followerRangeRelaxed(filtered.isFollowerRangeRelaxed())
                    .rejections(filtered.getRejections());
            filtered.getRejections().forEach((reason, count) -> metrics.recordRejection(reason.getKey(), count));

            List<RankedResult> ranked = rankingEngine.rank(filtered.getPassed(), query);
            int limit = Math.min(query.effectiveTargetCount(), ranked.size());
            results.addAll(ranked.subList(0, limit));
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            degraded = true;
            stats.errorCategory(category);
            log.error("[SEARCH] Search {} aborted: category={} error={}", searchId, category.name(), e.getMessage(), e);
        } finally {
            if (previous != null) {
                MDC.put(SEARCH_ID, previous);
            } else {
                MDC.remove(SEARCH_ID);
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        VerificationStats built = stats.build();
        metrics.recordSearch(durationMs, results.size(), degraded);
        log.info("[SEARCH] Completed searchId={} results={} durationMs={} stats={}", searchId, results.size(), durationMs, built);
        return new SearchOutcome(searchId, query, List.copyOf(results), built, durationMs);
    }

    /** Verification must never sink the search; anything it throws means lenient-only filtering. */
    private VerificationResult verify(List<CreatorRecord> selected, int verifyCap, Instant deadline) {
        try {
            return verificationGate.verify(selected, verifyCap, deadline);
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.warn("[SEARCH] Verification stage failed ({}); continuing with unverified candidates: {}",
                    category.name(), e.getMessage());
            List<Candidate> unverified = new ArrayList<>(selected.size());
            for (CreatorRecord r : selected) unverified.add(Candidate.unverified(r));
            return VerificationResult.builder()
                    .candidates(unverified)
                    .lenientFallback(true)
                    .failureCategory(category, selected.size())
                    .failed(selected.size())
                    .build();
        }
    }

    private void recordVerification(VerificationResult v) {
        metrics.recordVerification("verified", v.getVerified());
        metrics.recordVerification("failed", v.getFailed());
        metrics.recordVerification("skipped", v.getBudgetSkipped());
        metrics.recordCacheHits(v.getCacheHits());
        metrics.recordExternalCalls(v.getExternalCalls());
        v.getFailureCategories().forEach((category, count) -> metrics.recordVerificationFailure(category.name(), count));
    }
}
