package com.di.creatormatch.agent.gateway;

import com.di.creatormatch.agent.creator.Platform;
import com.di.creatormatch.agent.gateway.dto.MediaKit;
import com.di.creatormatch.agent.gateway.dto.MediaKitSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retrying, normalizing front of the metrics provider. Each public method is one logical call:
 * retries happen inside it and are not visible to callers counting calls.
 */
@Slf4j
@Service
public class MetricsGateway {

    @FunctionalInterface
    public interface ProviderCall<T> {
        T call() throws MetricsProviderException;
    }

    private final MetricsProvider provider;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final int lookupLimit;

    @Autowired
    public MetricsGateway(MetricsProvider provider, GatewayProperties properties) {
        this(provider, properties.toRetryPolicy(), Sleeper.THREAD,
                () -> ThreadLocalRandom.current().nextDouble(), properties.getLookupLimit());
    }

    public MetricsGateway(MetricsProvider provider, RetryPolicy retryPolicy, Sleeper sleeper,
                          DoubleSupplier random, int lookupLimit) {
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.random = random;
        this.lookupLimit = lookupLimit;
    }

    /** Text lookup, retried on transient failures. */
    public List<MediaKitSummary> lookup(Platform platform, String query) throws MetricsProviderException {
        return withRetry("lookup", () -> provider.lookupByText(platform, query, lookupLimit));
    }

    /** Detail fetch by direct token, retried on transient failures and normalized. 404 is not retried. */
    public NormalizedProfile fetchProfile(Platform platform, String token) throws MetricsProviderException {
        MediaKit kit = withRetry("detail", () -> provider.fetchDetail(platform, token));
        return MetricsNormalizer.normalize(kit, platform, token);
    }

    public <T> T withRetry(String operation, ProviderCall<T> call) throws MetricsProviderException {
        int retries = 0;
        while (true) {
            try {
                return call.call();
            } catch (MetricsProviderException e) {
                if (!retryPolicy.shouldRetry(e, retries)) {
                    if (e.isRetryable()) {
                        log.warn("[GATEWAY] {} failed after {} retries: {}", operation, retries, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = retryPolicy.delayFor(retries, e.getRetryAfter(), random.getAsDouble());
                retries++;
                log.info("[GATEWAY] {} retry {}/{} in {} ms (status={}, retryAfter={})", operation, retries,
                        retryPolicy.getMaxRetries(), delay.toMillis(), e.getStatusCode(), e.getRetryAfter());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new MetricsProviderException(operation + " interrupted during backoff", e.getStatusCode(), null, true, ie);
                }
            }
        }
    }
}
