package com.di.creatormatch.agent.verification;

import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.gateway.MetricsGateway;
import com.di.creatormatch.agent.gateway.MetricsNormalizer;
import com.di.creatormatch.agent.gateway.MetricsProviderException;
import com.di.creatormatch.agent.gateway.NormalizedProfile;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;
import com.di.creatormatch.agent.store.CandidateStore;
import com.di.creatormatch.aspect.ErrorCategory;
import com.di.creatormatch.aspect.LogStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cache-first verification of the pre-filtered selection.
 * <p>
 * Records with complete metrics verified inside the freshness window are taken as they are. The rest are
 * verified against the metrics provider through a {@link BoundedWorkerPool}, each one paid for from a
 * {@link CallBudget} before its first call goes out: one call when the record carries a direct re-fetch
 * token, two (lookup then detail) otherwise. Successful fetches are written back to the store.
 * <p>
 * Never throws. If every attempt fails the selection comes back unverified with
 * {@code lenientFallback} set.
 */
@Slf4j
@Service
public class VerificationGate {

    static final int DIRECT_FETCH_COST = 1;
    static final int LOOKUP_FETCH_COST = 2;

    private final MetricsGateway gateway;
    private final CandidateStore store;
    private final Clock clock;
    private final Duration freshness;
    private final int maxConcurrency;

    @Autowired
    public VerificationGate(MetricsGateway gateway, CandidateStore store, VerificationProperties properties, Clock clock) {
        this(gateway, store, clock, Duration.ofHours(properties.getFreshnessHours()), properties.getMaxConcurrency());
    }

    public VerificationGate(MetricsGateway gateway, CandidateStore store, Clock clock, Duration freshness, int maxConcurrency) {
        this.gateway = gateway;
        this.store = store;
        this.clock = clock;
        this.freshness = freshness;
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Verifies the selection.
     *
     * @param selected  pre-filtered records, in pre-filter order
     * @param verifyCap maximum external calls for this run
     * @param deadline  run deadline; workers still running then are abandoned (null = none)
     */
    @LogStage("VERIFY")
    public VerificationResult verify(List<CreatorRecord> selected, int verifyCap, Instant deadline) {
        if (selected == null || selected.isEmpty()) {
            return VerificationResult.empty();
        }
        List<CreatorRecord> unique = dedupe(selected);
        Instant now = clock.instant();
        CallBudget budget = new CallBudget(verifyCap);

        // Slot per record so output keeps input order whatever order workers finish in.
        Candidate[] slots = new Candidate[unique.size()];
        Map<Integer, Future<Attempt>> pending = new LinkedHashMap<>();
        int cacheHits = 0;
        int budgetSkipped = 0;

        try (BoundedWorkerPool pool = new BoundedWorkerPool(maxConcurrency, "verify")) {
            for (int i = 0; i < unique.size(); i++) {
                CreatorRecord record = unique.get(i);
                if (record.isFresh(now, freshness) && record.getMetrics().isCompleteFor(record.getPlatform())) {
                    slots[i] = Candidate.verified(record);
                    cacheHits++;
                    continue;
                }
                int cost = costOf(record);
                if (!budget.tryReserve(cost)) {
                    slots[i] = Candidate.unverified(record);
                    budgetSkipped++;
                    log.debug("[VERIFY] Budget exhausted, leaving {} unverified (cost={}, reserved={}/{})",
                            record.getId(), cost, budget.getReserved(), budget.getCap());
                    continue;
                }
                pending.put(i, pool.submit(() -> attempt(record, budget)));
            }

            Map<ErrorCategory, Integer> failures = new EnumMap<>(ErrorCategory.class);
            int verified = 0;
            int failed = 0;
            for (Map.Entry<Integer, Future<Attempt>> entry : pending.entrySet()) {
                int i = entry.getKey();
                CreatorRecord record = unique.get(i);
                Attempt outcome = await(entry.getValue(), record, deadline);
                if (outcome.isSuccess()) {
                    slots[i] = Candidate.verified(outcome.verified);
                    verified++;
                } else {
                    slots[i] = Candidate.failed(record);
                    failed++;
                    failures.merge(outcome.failure, 1, Integer::sum);
                }
            }
            int externalCalls = budget.getIssued();

            boolean fallback = !pending.isEmpty() && verified == 0;
            if (fallback) {
                log.warn("[VERIFY] All {} verification attempts failed ({}); continuing with lenient filtering only",
                        pending.size(), failures);
                for (int i = 0; i < slots.length; i++) {
                    if (!slots[i].isVerified()) {
                        slots[i] = Candidate.unverified(unique.get(i));
                    }
                }
            }

            log.info("[VERIFY] selected={} unique={} cacheHits={} verified={} failed={} budgetSkipped={} externalCalls={}/{} maxInFlight={} lenientFallback={}",
                    selected.size(), unique.size(), cacheHits, verified, failed, budgetSkipped,
                    externalCalls, verifyCap, pool.getMaxInFlight(), fallback);

            return VerificationResult.builder()
                    .candidates(List.of(slots))
                    .cacheHits(cacheHits)
                    .verified(verified)
                    .failed(failed)
                    .budgetSkipped(budgetSkipped)
                    .externalCalls(externalCalls)
                    .lenientFallback(fallback)
                    .failureCategories(failures)
                    .build();
        }
    }

    static int costOf(CreatorRecord record) {
        return hasText(record.getExternalId()) ? DIRECT_FETCH_COST : LOOKUP_FETCH_COST;
    }

    private Attempt await(Future<Attempt> future, CreatorRecord record, Instant deadline) {
        try {
            if (deadline == null) {
                return future.get();
            }
            long remaining = Math.max(0L, Duration.between(clock.instant(), deadline).toNanos());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[VERIFY] Deadline reached, abandoning verification of {}", record.getId());
            return Attempt.failure(ErrorCategory.TIMEOUT_ERROR);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[VERIFY] Verification of {} failed unexpectedly: {}", record.getId(), cause.toString());
            return Attempt.failure(ErrorCategory.categorize(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[VERIFY] Interrupted while waiting for verification of {}", record.getId());
            return Attempt.failure(ErrorCategory.TIMEOUT_ERROR);
        }
    }

    /** Runs on a worker thread. Calls are already reserved; failures are returned, not thrown. */
    private Attempt attempt(CreatorRecord record, CallBudget budget) {
        try {
            String token = record.getExternalId();
            if (!hasText(token)) {
                token = lookupToken(record, budget);
                if (token == null) {
                    log.info("[VERIFY] No provider profile matches {} ({})", record.getId(), record.getUsername());
                    return Attempt.failure(ErrorCategory.NOT_FOUND);
                }
            }
            budget.recordIssued();
            NormalizedProfile profile = gateway.fetchProfile(record.getPlatform(), token);
            CreatorRecord merged = ProfileMerger.merge(record, profile, clock.instant());
            writeBack(merged);
            log.debug("[VERIFY] Verified {} (metricsComplete={})", record.getId(), merged.isMetricsComplete());
            return Attempt.success(merged);
        } catch (MetricsProviderException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.info("[VERIFY] Verification of {} failed: category={} message={}", record.getId(), category, e.getMessage());
            return Attempt.failure(category);
        }
    }

    private String lookupToken(CreatorRecord record, CallBudget budget) throws MetricsProviderException {
        String query = hasText(record.getUsername()) ? record.getUsername() : record.getDisplayName();
        if (!hasText(query)) return null;
        budget.recordIssued();
        List<MediaKitSummary> hits = gateway.lookup(record.getPlatform(), query);
        for (MediaKitSummary hit : hits) {
            if (matches(hit, record)) {
                return MetricsNormalizer.directFetchToken(hit);
            }
        }
        return null;
    }

    private static boolean matches(MediaKitSummary hit, CreatorRecord record) {
        if (hit == null || hit.getUsername() == null || record.getUsername() == null) return false;
        if (hit.getPlatformType() != null && record.getPlatform() != null
                && hit.getPlatformType() != record.getPlatform().getCode()) {
            return false;
        }
        return normalizeHandle(hit.getUsername()).equals(normalizeHandle(record.getUsername()));
    }

    private void writeBack(CreatorRecord merged) {
        try {
            if (!store.updateVerified(merged)) {
                log.debug("[VERIFY] Store has no record {}; verified data kept for this run only", merged.getId());
            }
        } catch (RuntimeException e) {
            log.warn("[VERIFY] Could not persist verified metrics for {}: {}", merged.getId(), e.getMessage());
        }
    }

    private static List<CreatorRecord> dedupe(List<CreatorRecord> selected) {
        Map<String, CreatorRecord> byIdentity = new LinkedHashMap<>();
        for (CreatorRecord r : selected) {
            byIdentity.putIfAbsent(r.identityKey(), r);
        }
        if (byIdentity.size() < selected.size()) {
            log.debug("[VERIFY] Dropped {} duplicate selections", selected.size() - byIdentity.size());
        }
        return new ArrayList<>(byIdentity.values());
    }

    private static String normalizeHandle(String handle) {
        String h = handle.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("@") ? h.substring(1) : h;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static final class Attempt {
        final CreatorRecord verified;
        final ErrorCategory failure;

        private Attempt(CreatorRecord verified, ErrorCategory failure) {
            this.verified = verified;
            this.failure = failure;
        }

        static Attempt success(CreatorRecord verified) {
            return new Attempt(verified, null);
        }

        static Attempt failure(ErrorCategory category) {
            return new Attempt(null, category);
        }

        boolean isSuccess() {
            return verified != null;
        }
    }
}
