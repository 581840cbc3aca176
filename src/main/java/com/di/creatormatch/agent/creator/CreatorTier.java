package com.di.creatormatch.agent.creator;

/**
 * Reach tier by follower count: micro &lt; 50k &le; mid &lt; 500k &le; macro &lt; 2M &le; mega.
 */
public enum CreatorTier {
    MICRO,
    MID,
    MACRO,
    MEGA,
    UNKNOWN;

    private static final long MID_MIN = 50_000L;
    private static final long MACRO_MIN = 500_000L;
    private static final long MEGA_MIN = 2_000_000L;

    public static CreatorTier of(Long followers) {
        if (followers == null || followers <= 0) return UNKNOWN;
        if (followers < MID_MIN) return MICRO;
        if (followers < MACRO_MIN) return MID;
        if (followers < MEGA_MIN) return MACRO;
        return MEGA;
    }
}
