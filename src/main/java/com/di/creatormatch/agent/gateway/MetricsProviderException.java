package com.di.creatormatch.agent.gateway;

import lombok.Getter;

import java.time.Duration;

/**
 * Failure of a single metrics provider call. Carries enough detail for the retry policy
 * (status, Retry-After, timeout) and for failure classification.
 */
@Getter
public class MetricsProviderException extends Exception {

    /** HTTP status, or null when no response was received. */
    private final Integer statusCode;
    /** Server-requested delay before the next attempt, or null. */
    private final Duration retryAfter;
    private final boolean timeout;

    public MetricsProviderException(String message, Integer statusCode, Duration retryAfter, boolean timeout, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
        this.timeout = timeout;
    }

    public static MetricsProviderException http(int statusCode, String message, Duration retryAfter) {
        return new MetricsProviderException(message, statusCode, retryAfter, false, null);
    }

    public static MetricsProviderException timeout(String message, Throwable cause) {
        return new MetricsProviderException(message, null, null, true, cause);
    }

    public static MetricsProviderException network(String message, Throwable cause) {
        return new MetricsProviderException(message, null, null, false, cause);
    }

    public static MetricsProviderException notFound(String message) {
        return http(404, message, null);
    }

    /** Timeouts, 429 and 5xx are transient; everything else (including 404) is not retried. */
    public boolean isRetryable() {
        if (timeout) return true;
        if (statusCode == null) return false;
        return statusCode == 429 || statusCode >= 500;
    }

    public boolean isNotFound() {
        return statusCode != null && statusCode == 404;
    }

    public boolean isRateLimited() {
        return statusCode != null && statusCode == 429;
    }

    public boolean isAuthFailure() {
        return statusCode != null && (statusCode == 401 || statusCode == 403);
    }
}
