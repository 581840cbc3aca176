package com.di.creatormatch.agent.intelligence;

import lombok.Value;

/**
 * Brand affinity sub-score with the reason it deviates from neutral.
 */
@Value
public class BrandAffinity {

    public enum Signal {
        NO_BRAND_CONTEXT,
        NEUTRAL,
        PRIOR_MENTION,
        COMPETITOR_AMBASSADOR,
        COMPETITOR_MENTION,
        SATURATION
    }

    double score;
    Signal signal;
    /** Human-readable warning for conflicts and saturation; null otherwise. */
    String warning;

    public static BrandAffinity neutral(Signal signal) {
        return new BrandAffinity(0.5, signal, null);
    }
}
