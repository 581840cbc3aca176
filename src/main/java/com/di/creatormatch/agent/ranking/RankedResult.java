package com.di.creatormatch.agent.ranking;

import com.di.creatormatch.agent.creator.Candidate;
import com.di.creatormatch.agent.creator.CreatorRecord;
import com.di.creatormatch.agent.creator.CreatorTier;
import com.di.creatormatch.agent.creator.VerificationState;
import com.di.creatormatch.agent.intelligence.BrandAffinity;
import com.di.creatormatch.agent.intelligence.NicheRelevance;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** One ranked candidate with the numbers that explain its position. */
@Value
@Builder(toBuilder = true)
public class RankedResult {

    /** 1-based. */
    int rankPosition;

    @JsonIgnore
    Candidate candidate;

    /** Final relevance: weighted sum times size multiplier, in [0, 1]. */
    double relevanceScore;
    double weightedScore;
    double sizeMultiplier;
    ScoreBreakdown scores;

    CreatorTier tier;
    NicheRelevance.MatchType nicheMatchType;
    BrandAffinity.Signal brandSignal;

    @Singular
    List<String> warnings;

    public CreatorRecord getCreator() {
        return candidate.getRecord();
    }

    public VerificationState getVerificationState() {
        return candidate.getState();
    }
}
