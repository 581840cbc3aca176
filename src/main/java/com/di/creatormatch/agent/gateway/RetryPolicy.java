package com.di.creatormatch.agent.gateway;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff with jitter for metrics provider calls.
 * <p>Delay for retry {@code n} (0-based) is {@code min(base * 2^n, max)} with up to {@code jitterRatio}
 * added or removed, never below {@code minDelay}. A server {@code Retry-After} replaces the computed
 * delay, still capped at {@code maxDelay}.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);
    @Builder.Default
    double jitterRatio = 0.1;
    @Builder.Default
    Duration minDelay = Duration.ofMillis(100);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /** Whether a failure on attempt {@code retriesSoFar} may be retried. */
    public boolean shouldRetry(MetricsProviderException failure, int retriesSoFar) {
        return failure.isRetryable() && retriesSoFar < maxRetries;
    }

    /**
     * @param retriesSoFar number of retries already performed (0 for the first retry)
     * @param retryAfter   server-requested delay, or null
     * @param random       uniform sample in [0, 1) used for jitter
     */
    public Duration delayFor(int retriesSoFar, Duration retryAfter, double random) {
        long capMs = maxDelay.toMillis();
        if (retryAfter != null && !retryAfter.isNegative()) {
            return Duration.ofMillis(Math.min(retryAfter.toMillis(), capMs));
        }
        double exp = baseDelay.toMillis() * Math.pow(2, Math.min(retriesSoFar, 30));
        double delay = Math.min(exp, capMs);
        double jitter = delay * jitterRatio * (2 * random - 1);
        double withJitter = Math.min(delay + jitter, capMs);
        return Duration.ofMillis(Math.max(minDelay.toMillis(), Math.round(withJitter)));
    }
}
