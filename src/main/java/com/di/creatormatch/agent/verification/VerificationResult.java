package com.di.creatormatch.agent.verification;

import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.aspect.ErrorCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one verification pass. {@code candidates} keeps the order of the input selection.
 */
@Value
@Builder
public class VerificationResult {

    @Singular
    List<Candidate> candidates;

    int cacheHits;
    int verified;
    int failed;
    /** Candidates left unverified because the call budget could not cover them. */
    int budgetSkipped;
    int externalCalls;
    boolean lenientFallback;

    @Singular("failureCategory")
    Map<ErrorCategory, Integer> failureCategories;

    public static VerificationResult empty() {
        return VerificationResult.builder().build();
    }
}
