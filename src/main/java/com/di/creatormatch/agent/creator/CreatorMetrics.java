package com.di.creatormatch.agent.creator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.Map;

/**
 * Normalized metrics for a creator. Every field is independently nullable; an empty map means
 * the provider returned no breakdown.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreatorMetrics {

    /** Audience credibility 0–100 (Instagram only). */
    Double credibilityScore;
    /** Engagement rate as a fraction (0.035 = 3.5 %). */
    Double engagementRate;
    /** Six-month follower growth as a fraction (0.12 = +12 %). */
    Double followerGrowthRate6m;
    /** Audience gender split in percent, keys {@code female} / {@code male}. */
    Map<String, Double> audienceGenders;
    /** Audience age distribution in percent keyed by band label ({@code 18-24}, ...). */
    Map<String, Double> audienceAgeDistribution;
    /** Audience geography in percent keyed by ISO country code. */
    Map<String, Double> audienceGeography;

    public static CreatorMetrics empty() {
        return CreatorMetrics.builder().build();
    }

    public Map<String, Double> getAudienceGenders() {
        return audienceGenders != null ? audienceGenders : Collections.emptyMap();
    }

    public Map<String, Double> getAudienceAgeDistribution() {
        return audienceAgeDistribution != null ? audienceAgeDistribution : Collections.emptyMap();
    }

    public Map<String, Double> getAudienceGeography() {
        return audienceGeography != null ? audienceGeography : Collections.emptyMap();
    }

    /** Spain share of the audience in percent, or null when there is no geography breakdown. */
    public Double getSpainAudiencePct() {
        Map<String, Double> geo = getAudienceGeography();
        if (geo.isEmpty()) return null;
        Double es = geo.get("ES");
        if (es == null) es = geo.get("es");
        return es != null ? es : 0.0;
    }

    public Double getGenderPct(String gender) {
        Map<String, Double> genders = getAudienceGenders();
        if (genders.isEmpty() || gender == null) return null;
        return genders.get(gender);
    }

    /**
     * True when every metric the filters rely on is present for the given platform.
     * Credibility is only required where the platform reports it.
     */
    public boolean isCompleteFor(Platform platform) {
        if (engagementRate == null || getAudienceGeography().isEmpty()) return false;
        return platform == null || !platform.reportsCredibility() || credibilityScore != null;
    }
}
