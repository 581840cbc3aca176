package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.CreatorMetrics;
import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts provider payloads into {@link NormalizedProfile}. Missing or malformed fields become null,
 * never an exception.
 */
@Slf4j
public final class MetricsNormalizer {

    private MetricsNormalizer() {
    }

    public static NormalizedProfile normalize(MediaKit kit, Platform platform, String externalId) {
        MediaKit.AudienceSection audience = kit.getAudienceData() != null ? kit.getAudienceData().getFollowers() : null;

        Double credibility = null;
        if (audience != null && platform != null && platform.reportsCredibility()) {
            credibility = audience.getAudienceCredibilityPercentage();
        }

        CreatorMetrics metrics = CreatorMetrics.builder()
                .credibilityScore(credibility)
                .engagementRate(toFraction(kit.getAvgEngagementRate(), false))
                .followerGrowthRate6m(toFraction(kit.getFollowersLast6MonthEvolution(), true))
                .audienceGenders(genders(audience))
                .audienceAgeDistribution(ageDistribution(audience))
                .audienceGeography(geography(audience))
                .build();

        return NormalizedProfile.builder()
                .externalId(externalId)
                .username(kit.getUsername())
                .displayName(blankToNull(kit.getFullname()))
                .bio(blankToNull(kit.getDescription()))
                .followers(kit.getFollowers())
                .interests(kit.getInterests() != null ? List.copyOf(nonBlank(kit.getInterests())) : Collections.emptyList())
                .brandMentions(brandMentions(kit.getBrandMentions()))
                .metrics(metrics)
                .build();
    }

    /**
     * Direct-fetch token for a lookup hit: last path segment of {@code mediakit_url}, else the external
     * profile id, else the username.
     */
    public static String directFetchToken(MediaKitSummary summary) {
        String fromUrl = lastPathSegment(summary.getMediakitUrl());
        if (fromUrl != null) return fromUrl;
        if (summary.getExternalSocialProfileId() != null && !summary.getExternalSocialProfileId().isBlank()) {
            return summary.getExternalSocialProfileId();
        }
        return summary.getUsername();
    }

    static String lastPathSegment(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String path = URI.create(url.trim()).getPath();
            if (path == null) return null;
            String[] parts = path.replaceAll("^/+|/+$", "").split("/");
            return parts.length >= 2 && !parts[parts.length - 1].isBlank() ? parts[parts.length - 1] : null;
        } catch (IllegalArgumentException e) {
            log.debug("[GATEWAY] Unparseable mediakit url {}: {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Rates arrive either as fractions or as percentages. Engagement above 1 is a percentage;
     * growth is a percentage once its magnitude reaches 1.
     */
    static Double toFraction(Double value, boolean signed) {
        if (value == null || !Double.isFinite(value)) return null;
        double magnitude = signed ? Math.abs(value) : value;
        return magnitude >= 1 ? value / 100.0 : value;
    }

    private static Map<String, Double> genders(MediaKit.AudienceSection audience) {
        if (audience == null || audience.getGenders() == null) return Collections.emptyMap();
        Map<String, Double> out = new LinkedHashMap<>();
        audience.getGenders().forEach((k, v) -> {
            if (k != null && v != null) out.put(k.toLowerCase(Locale.ROOT), v);
        });
        return out;
    }

    private static Map<String, Double> ageDistribution(MediaKit.AudienceSection audience) {
        if (audience == null || audience.getAverageAge() == null) return Collections.emptyMap();
        Map<String, Double> out = new LinkedHashMap<>();
        for (MediaKit.AgeBucket bucket : audience.getAverageAge()) {
            if (bucket == null || bucket.getLabel() == null || bucket.getLabel().isBlank()) continue;
            double female = bucket.getFemale() != null ? bucket.getFemale() : 0.0;
            double male = bucket.getMale() != null ? bucket.getMale() : 0.0;
            out.merge(bucket.getLabel().trim(), Math.round((female + male) * 10_000.0) / 10_000.0, Double::sum);
        }
        return out;
    }

    private static Map<String, Double> geography(MediaKit.AudienceSection audience) {
        if (audience == null || audience.getLocationByCountry() == null) return Collections.emptyMap();
        Map<String, Double> out = new LinkedHashMap<>();
        for (MediaKit.CountryShare share : audience.getLocationByCountry()) {
            if (share == null || share.getName() == null || share.getName().isBlank()) continue;
            Double pct = share.share();
            if (pct == null || pct == 0.0) continue;
            String iso = CountryCodes.toIso(share.getName());
            if (iso == null) {
                log.debug("[GATEWAY] Unknown country name in audience geography: {}", share.getName());
                out.put(share.getName().trim(), pct);
            } else {
                out.put(iso, pct);
            }
        }
        return out;
    }

    private static List<String> brandMentions(List<MediaKit.BrandMention> mentions) {
        if (mentions == null) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (MediaKit.BrandMention m : mentions) {
            if (m != null && m.getUsername() != null && !m.getUsername().isBlank()) out.add(m.getUsername());
        }
        return out;
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return out;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
