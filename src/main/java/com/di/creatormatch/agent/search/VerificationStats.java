package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.filter.RejectionReason;
import com.di.creatormatch.aspect.ErrorCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/** Funnel counters for one search. */
@Value
@Builder(toBuilder = true)
public class VerificationStats {

    /** Candidates pulled from the store. */
    int totalCandidates;
    /** Candidates kept by the pre-filter. */
    int preFiltered;
    int verified;
    int failedVerification;
    int cacheHits;
    int externalCalls;
    int budgetSkipped;
    int passedFilters;
    boolean lenientFallback;
    boolean followerRangeRelaxed;

    @Singular
    Map<RejectionReason, Integer> rejections;

    @Singular("failure")
    Map<ErrorCategory, Integer> failures;

    /** Set when a stage failed and the search returned early. */
    ErrorCategory errorCategory;
}
