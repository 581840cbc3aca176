package com.di.creatormatch.agent.campaign;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Structured campaign brief driving one search. Built once by the brief parser (or by an API caller)
 * and never mutated while the pipeline runs.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CampaignQuery {

    public static final int DEFAULT_TARGET_COUNT = 5;
    public static final double DEFAULT_MIN_CREDIBILITY = 70.0;
    public static final double DEFAULT_MIN_SPAIN_AUDIENCE_PCT = 60.0;

    // ------------------------------------------------------------------ //
    // Result shape                                                        //
    // ------------------------------------------------------------------ //

    @Min(1)
    @Max(50)
    @Builder.Default
    int targetCount = DEFAULT_TARGET_COUNT;

    /** Optional split by creator gender; its total overrides {@link #targetCount} when larger. */
    GenderSplit genderSplit;

    @Builder.Default
    GenderFilter creatorGender = GenderFilter.ANY;

    @Builder.Default
    GenderFilter targetAudienceGender = GenderFilter.ANY;

    @Singular("targetAgeRange")
    List<AgeBand> targetAgeRanges;

    // ------------------------------------------------------------------ //
    // Brand identity                                                      //
    // ------------------------------------------------------------------ //

    String brandName;
    String brandHandle;
    String brandCategory;

    // ------------------------------------------------------------------ //
    // Creative intent                                                     //
    // ------------------------------------------------------------------ //

    @Singular("toneKeyword")
    List<String> toneKeywords;
    @Singular("themeKeyword")
    List<String> themeKeywords;

    // ------------------------------------------------------------------ //
    // Niche targeting                                                     //
    // ------------------------------------------------------------------ //

    String campaignNiche;
    @Singular("topicKeyword")
    List<String> topicKeywords;
    @Singular("excludeNiche")
    List<String> excludeNiches;
    boolean excludeCompetitorAmbassadors;
    @Singular("searchKeyword")
    List<String> searchKeywords;

    // ------------------------------------------------------------------ //
    // Size preference (advisory)                                          //
    // ------------------------------------------------------------------ //

    Long preferredFollowerMin;
    Long preferredFollowerMax;

    // ------------------------------------------------------------------ //
    // Quality thresholds                                                  //
    // ------------------------------------------------------------------ //

    @Builder.Default
    Double minCredibilityScore = DEFAULT_MIN_CREDIBILITY;
    @Builder.Default
    Double minSpainAudiencePct = DEFAULT_MIN_SPAIN_AUDIENCE_PCT;
    Double minEngagementRate;
    Double minFollowerGrowthRate;

    // ------------------------------------------------------------------ //
    // Ranking and parser provenance                                       //
    // ------------------------------------------------------------------ //

    /** Weight suggestions keyed by factor name ({@code engagement}, {@code niche_match}, ...). */
    @Singular("suggestedWeight")
    Map<String, Double> suggestedWeights;

    @Builder.Default
    double parseConfidence = 1.0;
    String fallbackReasoning;

    /** Number of results to return, honouring the gender split when it asks for more. */
    public int effectiveTargetCount() {
        int split = genderSplit != null ? genderSplit.total() : 0;
        return Math.max(targetCount, split);
    }

    public boolean hasBrandContext() {
        return (brandName != null && !brandName.isBlank()) || (brandHandle != null && !brandHandle.isBlank());
    }

    public boolean hasCreativeBrief() {
        return !toneKeywords.isEmpty() || !themeKeywords.isEmpty();
    }

    public boolean hasCampaignNiche() {
        return campaignNiche != null && !campaignNiche.isBlank();
    }

    /** Minimum engagement as a fraction; values above 1 are read as percentages. */
    public Double normalizedMinEngagement() {
        if (minEngagementRate == null) return null;
        return minEngagementRate > 1 ? minEngagementRate / 100.0 : minEngagementRate;
    }
}
