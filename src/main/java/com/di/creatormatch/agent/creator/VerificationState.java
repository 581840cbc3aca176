package com.di.creatormatch.agent.creator;

/**
 * Verification state of a candidate within one search run.
 * Strict filtering applies only to {@link #VERIFIED}; every other state is filtered leniently.
 */
public enum VerificationState {
    /** Metrics fetched during this run, or cached metrics that are complete and fresh. */
    VERIFIED,
    /** Not verified: no metrics, stale metrics, budget exhausted, or upstream-unavailable fallback. */
    UNVERIFIED,
    /** Verification was attempted and failed after retries, or no matching profile was found. */
    FAILED_VERIFICATION;

    public boolean isVerified() {
        return this == VERIFIED;
    }
}
