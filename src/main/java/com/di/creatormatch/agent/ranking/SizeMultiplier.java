package com.di.creatormatch.agent.ranking;

/**
 * Reach adjustment applied on top of the weighted score: 1.0 inside the preferred follower range,
 * proportionally lower outside it with a floor, and a fixed low value when reach is unknown.
 */
public final class SizeMultiplier {

    private SizeMultiplier() {
    }

    public static double of(Long followers, Long preferredMin, Long preferredMax, ScoringProperties properties) {
        if (followers == null || followers <= 0) {
            return properties.getUnknownFollowersMultiplier();
        }
        if (preferredMin != null && preferredMin > 0 && followers < preferredMin) {
            return Math.max(properties.getBelowRangeFloor(), (double) followers / preferredMin);
        }
        if (preferredMax != null && preferredMax > 0 && followers > preferredMax) {
            return Math.max(properties.getAboveRangeFloor(), (double) preferredMax / followers);
        }
        return 1.0;
    }
}
