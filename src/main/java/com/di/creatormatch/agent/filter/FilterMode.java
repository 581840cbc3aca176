package com.di.creatormatch.agent.filter;

import com.di.creatormatch.agent.creator.Candidate;

/**
 * STRICT rejects a candidate whose required metric is missing; LENIENT lets it through and leaves
 * deprioritization to ranking. A present value below threshold is rejected in both modes.
 */
public enum FilterMode {
    STRICT,
    LENIENT;

    public static FilterMode forCandidate(Candidate candidate) {
        return candidate.isVerified() ? STRICT : LENIENT;
    }

    boolean rejectsMissing() {
        return this == STRICT;
    }
}
