package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;

import java.util.Comparator;
import java.util.Locale;

/**
 * Shared ordering and matching rules so every store implementation returns the same pools.
 */
final class CandidateOrdering {

    /** Followers desc (unknown last), then id asc. */
    static final Comparator<CreatorRecord> BY_REACH = Comparator
            .comparingLong((CreatorRecord r) -> r.hasKnownFollowers() ? r.getFollowers() : -1L)
            .reversed()
            .thenComparing(CreatorRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    /** Complete metrics first, then {@link #BY_REACH}. */
    static final Comparator<CreatorRecord> FALLBACK = Comparator
            .comparing((CreatorRecord r) -> !r.isMetricsComplete())
            .thenComparing(BY_REACH);

    private CandidateOrdering() {
    }

    static boolean matchesNiche(CreatorRecord r, String niche) {
        if (niche == null || niche.isBlank()) return false;
        String n = niche.trim().toLowerCase(Locale.ROOT);
        if (r.getPrimaryNiche() != null && r.getPrimaryNiche().equalsIgnoreCase(n)) return true;
        for (String interest : r.getInterests()) {
            if (interest != null && interest.toLowerCase(Locale.ROOT).contains(n)) return true;
        }
        return false;
    }

    static boolean matchesKeyword(CreatorRecord r, String keyword) {
        if (keyword == null || keyword.isBlank()) return false;
        String k = keyword.trim().toLowerCase(Locale.ROOT);
        if (contains(r.getUsername(), k) || contains(r.getDisplayName(), k) || contains(r.getBio(), k)) return true;
        for (String interest : r.getInterests()) {
            if (contains(interest, k)) return true;
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
