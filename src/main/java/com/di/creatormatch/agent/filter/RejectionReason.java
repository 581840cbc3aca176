package com.di.creatormatch.agent.filter;

import java.util.Locale;

/** Why the filter engine dropped a candidate. */
public enum RejectionReason {
    CREDIBILITY,
    SPAIN_AUDIENCE,
    ENGAGEMENT,
    FOLLOWER_GROWTH,
    AUDIENCE_GENDER,
    FOLLOWER_RANGE,
    CREATOR_GENDER,
    EXCLUDED_NICHE,
    COMPETITOR_AMBASSADOR;

    /** Lowercase key used in stats payloads and metric tags. */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
