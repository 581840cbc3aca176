package com.di.creatormatch.agent.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scoring constants for niche relevance, read from the {@code rules} section of the taxonomy YAML.
 * Defaults apply to any key the file omits.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NicheRules {
    @JsonProperty("exact_match_score")
    private double exactMatchScore = 0.95;
    @JsonProperty("related_niche_score")
    private double relatedNicheScore = 0.70;
    @JsonProperty("conflicting_niche_penalty")
    private double conflictingNichePenalty = 0.20;
    @JsonProperty("celebrity_threshold")
    private long celebrityThreshold = 5_000_000L;
    @JsonProperty("celebrity_mismatch_penalty")
    private double celebrityMismatchPenalty = 0.15;
    @JsonProperty("neutral_score")
    private double neutralScore = 0.5;
    @JsonProperty("generic_celebrity_score")
    private double genericCelebrityScore = 0.30;
    /** Partial keyword match scores {@code partialBase + ratio * partialSpan}. */
    @JsonProperty("partial_base")
    private double partialBase = 0.5;
    @JsonProperty("partial_span")
    private double partialSpan = 0.3;
}
