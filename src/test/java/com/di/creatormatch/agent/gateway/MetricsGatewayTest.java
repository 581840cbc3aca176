package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsGateway Tests")
class MetricsGatewayTest {

    private ScriptedProvider provider;
    private List<Duration> sleeps;
    private MetricsGateway gateway;

    @BeforeEach
    void setUp() {
        provider = new ScriptedProvider();
        sleeps = new ArrayList<>();
        gateway = new MetricsGateway(provider, RetryPolicy.defaults(), sleeps::add, () -> 0.5, 10);
    }

    // ============================================================================
    // Retry behaviour
    // ============================================================================

    @Test
    @DisplayName("Succeeds after transient failures with exponential backoff")
    void testLookup_RetriesTransientFailures() throws Exception {
        provider.failures.add(MetricsProviderException.http(503, "unavailable", null));
        provider.failures.add(MetricsProviderException.timeout("timed out", null));

        List<MediaKitSummary> hits = gateway.lookup(Platform.INSTAGRAM, "martapadel");

        assertEquals(1, hits.size());
        assertEquals(3, provider.lookupCalls);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    @DisplayName("Gives up after max retries and rethrows the last failure")
    void testLookup_GivesUpAfterMaxRetries() {
        for (int i = 0; i < 10; i++) {
            provider.failures.add(MetricsProviderException.http(500, "boom " + i, null));
        }
        MetricsProviderException e = assertThrows(MetricsProviderException.class,
                () -> gateway.lookup(Platform.INSTAGRAM, "x"));
        assertEquals(500, e.getStatusCode());
        assertEquals(4, provider.lookupCalls, "one call plus three retries");
        assertEquals(3, sleeps.size());
    }

    @Test
    @DisplayName("Honours Retry-After on 429")
    void testLookup_RetryAfterHonoured() throws Exception {
        provider.failures.add(MetricsProviderException.http(429, "rate limited", Duration.ofSeconds(12)));

        gateway.lookup(Platform.TIKTOK, "x");

        assertEquals(List.of(Duration.ofSeconds(12)), sleeps);
    }

    @Test
    @DisplayName("404 and auth failures are not retried")
    void testFetchProfile_NotFoundNotRetried() {
        provider.failures.add(MetricsProviderException.notFound("gone"));
        MetricsProviderException e = assertThrows(MetricsProviderException.class,
                () -> gateway.fetchProfile(Platform.INSTAGRAM, "tok"));
        assertTrue(e.isNotFound());
        assertEquals(1, provider.detailCalls);
        assertTrue(sleeps.isEmpty());

        provider.failures.add(MetricsProviderException.http(403, "forbidden", null));
        assertThrows(MetricsProviderException.class, () -> gateway.fetchProfile(Platform.INSTAGRAM, "tok"));
        assertEquals(2, provider.detailCalls);
    }

    @Test
    @DisplayName("Interrupted backoff surfaces as a timeout failure")
    void testWithRetry_InterruptedBackoff() {
        MetricsGateway interrupting = new MetricsGateway(provider, RetryPolicy.defaults(),
                d -> {
                    throw new InterruptedException("stop");
                }, () -> 0.5, 10);
        provider.failures.add(MetricsProviderException.http(502, "bad gateway", null));

        MetricsProviderException e = assertThrows(MetricsProviderException.class,
                () -> interrupting.lookup(Platform.INSTAGRAM, "x"));
        assertTrue(e.isTimeout());
        assertTrue(Thread.interrupted(), "interrupt flag restored");
    }

    // ============================================================================
    // Normalization through the gateway
    // ============================================================================

    @Test
    @DisplayName("fetchProfile normalizes the media kit and keeps the token")
    void testFetchProfile_Normalizes() throws Exception {
        NormalizedProfile profile = gateway.fetchProfile(Platform.INSTAGRAM, "tok-1");

        assertEquals("tok-1", profile.getExternalId());
        assertEquals("martapadel", profile.getUsername());
        assertEquals(84_000L, profile.getFollowers());
        assertEquals(0.045, profile.getMetrics().getEngagementRate(), 1e-9);
    }

    /** Provider that throws queued failures first, then answers. */
    static class ScriptedProvider implements MetricsProvider {
        final Deque<MetricsProviderException> failures = new ArrayDeque<>();
        int lookupCalls;
        int detailCalls;

        @Override
        public List<MediaKitSummary> lookupByText(Platform platform, String query, int limit) throws MetricsProviderException {
            lookupCalls++;
            if (!failures.isEmpty()) throw failures.poll();
            return List.of(MediaKitSummary.builder().username(query).build());
        }

        @Override
        public MediaKit fetchDetail(Platform platform, String token) throws MetricsProviderException {
            detailCalls++;
            if (!failures.isEmpty()) throw failures.poll();
            return MediaKit.builder()
                    .username("martapadel")
                    .followers(84_000L)
                    .avgEngagementRate(4.5)
                    .build();
        }
    }
}
