package com.di.creatormatch.aspect;

import com.di.creatormatch.agent.gateway.MetricsProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.validation.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.ApplicationContextException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.client.ResourceAccessException;

import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Failure categories shared by stage logging, verification failure counts and API error bodies.
 * <p>{@code ErrorCategory.categorize(e)} looks through executor and proxy wrappers first, then asks
 * the metrics provider status, then the type matchers in {@link #MATCHERS}.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCategory {

    UPSTREAM_UNAVAILABLE("Upstream unavailable", "Metrics provider answered with a server error"),
    RATE_LIMITED("Rate limited", "Metrics provider answered with HTTP 429"),
    AUTHENTICATION_ERROR("Authentication error", "Metrics provider refused the API token"),
    NOT_FOUND("Profile not found", "Metrics provider has no profile for the creator"),
    UPSTREAM_REJECTED("Upstream rejected request", "Metrics provider answered with a non-retryable client error"),
    TIMEOUT_ERROR("Timeout error", "Call or search run exceeded its deadline"),
    NETWORK_ERROR("Network error", "Connection to a remote service failed"),
    DATABASE_ERROR("Database error", "Candidate store operation failed"),
    VALIDATION_ERROR("Validation error", "Campaign query or weights are invalid"),
    CONFIGURATION_ERROR("Configuration error", "Bean or reference data could not be set up"),
    SERIALIZATION_ERROR("Serialization error", "Payload could not be read or written as JSON"),
    APPLICATION_ERROR("Application error", "Unexpected failure inside the matching pipeline"),
    UNKNOWN("Unknown error", "No exception was available to classify");

    private final String name;
    private final String description;

    /** Checked in insertion order. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isDatabaseError, DATABASE_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable t = unwrap(exception);
        if (t instanceof MetricsProviderException) {
            return fromProvider((MetricsProviderException) t);
        }
        return MATCHERS.entrySet().stream()
                .filter(entry -> entry.getKey().test(t))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(APPLICATION_ERROR);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof UndeclaredThrowableException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorCategory fromProvider(MetricsProviderException e) {
        if (e.isTimeout()) return TIMEOUT_ERROR;
        Integer status = e.getStatusCode();
        if (status == null) return NETWORK_ERROR;
        if (e.isAuthFailure()) return AUTHENTICATION_ERROR;
        if (e.isRateLimited()) return RATE_LIMITED;
        if (e.isNotFound()) return NOT_FOUND;
        return status >= 500 ? UPSTREAM_UNAVAILABLE : UPSTREAM_REJECTED;
    }

    // --- matchers ---

    private static boolean isTimeoutError(Throwable t) {
        if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
            return true;
        }
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("timed out");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof SocketException
                || t instanceof ResourceAccessException;
    }

    private static boolean isDatabaseError(Throwable t) {
        return t instanceof SQLException || t instanceof DataAccessException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof NoSuchElementException
                || t instanceof ValidationException
                || t instanceof MethodArgumentNotValidException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof BeanCreationException || t instanceof ApplicationContextException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof JsonProcessingException || t instanceof HttpMessageNotReadableException;
    }
}
