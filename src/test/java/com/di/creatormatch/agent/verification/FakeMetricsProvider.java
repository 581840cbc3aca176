package com.di.creatormatch.agent.verification;

import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.MetricsProvider;
import com.di.creatormatch.agent.gateway.MetricsProviderException;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hand-rolled provider for verification and pipeline tests. Serves a complete Spanish-audience media kit
 * for every token unless the token is listed as missing, or a failure status is configured for all calls.
 */
public class FakeMetricsProvider implements MetricsProvider {

    public final AtomicInteger lookupCalls = new AtomicInteger();
    public final AtomicInteger detailCalls = new AtomicInteger();
    public final AtomicInteger inFlight = new AtomicInteger();
    public final AtomicInteger maxInFlight = new AtomicInteger();
    public final Map<String, MediaKit> kits = new ConcurrentHashMap<>();
    public final Map<String, List<MediaKitSummary>> lookups = new ConcurrentHashMap<>();

    /** HTTP status every call fails with; null = succeed. */
    public volatile Integer failWithStatus;
    /** Simulated latency per call. */
    public volatile long latencyMs;

    @Override
    public List<MediaKitSummary> lookupByText(Platform platform, String query, int limit) throws MetricsProviderException {
        lookupCalls.incrementAndGet();
        enter();
        try {
            List<MediaKitSummary> configured = lookups.get(query);
            if (configured != null) return configured;
            return List.of(MediaKitSummary.builder()
                    .username(query)
                    .platformType(platform.getCode())
                    .mediakitUrl("https://provider.test/mediakit/tok-" + query)
                    .build());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public MediaKit fetchDetail(Platform platform, String token) throws MetricsProviderException {
        detailCalls.incrementAndGet();
        enter();
        try {
            MediaKit kit = kits.get(token);
            return kit != null ? kit : completeKit(token, 70.0, 85.0, 4.2);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void enter() throws MetricsProviderException {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                inFlight.decrementAndGet();
                throw MetricsProviderException.timeout("interrupted", e);
            }
        }
        Integer status = failWithStatus;
        if (status != null) {
            inFlight.decrementAndGet();
            throw MetricsProviderException.http(status, "HTTP " + status, null);
        }
    }

    public static MediaKit completeKit(String username, double spainPct, double credibility, double engagementPct) {
        MediaKit.AudienceSection audience = MediaKit.AudienceSection.builder()
                .audienceCredibilityPercentage(credibility)
                .genders(Map.of("female", 55.0, "male", 45.0))
                .averageAge(List.of(MediaKit.AgeBucket.builder().label("25-34").female(30.0).male(20.0).build()))
                .locationByCountry(List.of(
                        MediaKit.CountryShare.builder().name("Spain").percentage(spainPct).build(),
                        MediaKit.CountryShare.builder().name("Mexico").percentage(100.0 - spainPct).build()))
                .build();
        return MediaKit.builder()
                .username(username)
                .followers(150_000L)
                .avgEngagementRate(engagementPct)
                .followersLast6MonthEvolution(8.0)
                .audienceData(MediaKit.AudienceData.builder().followers(audience).build())
                .build();
    }
}
