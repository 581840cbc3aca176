package com.di.creatormatch.agent.intelligence;

import lombok.Value;

import java.util.List;

/**
 * Niche match sub-score and how it was reached.
 */
@Value
public class NicheRelevance {

    public enum MatchType {
        EXACT,
        RELATED,
        CONFLICTING,
        PARTIAL,
        NEUTRAL,
        EXCLUDED
    }

    double score;
    MatchType matchType;
    /** Niche the creator was classified into, or null. */
    String creatorNiche;
    List<String> matchedKeywords;
    boolean celebrityMismatch;
}
