package com.di.creatormatch.aspect;

import com.di.creatormatch.agent.gateway.MetricsProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Basic Enum Tests
    // ============================================================================

    @Test
    @DisplayName("Every category has a name and description")
    void testGetNameAndDescription() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty(), category.name());
            assertFalse(category.getDescription().isEmpty(), category.name());
        }
    }

    @Test
    @DisplayName("Null categorizes as unknown")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    // ============================================================================
    // Metrics provider failures
    // ============================================================================

    static Stream<Arguments> providerFailures() {
        return Stream.of(
                Arguments.of(MetricsProviderException.http(401, "unauthorized", null), ErrorCategory.AUTHENTICATION_ERROR),
                Arguments.of(MetricsProviderException.http(403, "forbidden", null), ErrorCategory.AUTHENTICATION_ERROR),
                Arguments.of(MetricsProviderException.http(429, "slow down", Duration.ofSeconds(2)), ErrorCategory.RATE_LIMITED),
                Arguments.of(MetricsProviderException.notFound("no kit"), ErrorCategory.NOT_FOUND),
                Arguments.of(MetricsProviderException.http(503, "unavailable", null), ErrorCategory.UPSTREAM_UNAVAILABLE),
                Arguments.of(MetricsProviderException.http(400, "bad request", null), ErrorCategory.UPSTREAM_REJECTED),
                Arguments.of(MetricsProviderException.timeout("read timed out", new SocketTimeoutException()), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(MetricsProviderException.network("connection reset", new ConnectException()), ErrorCategory.NETWORK_ERROR)
        );
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("providerFailures")
    @DisplayName("Provider failures categorize by status and kind")
    void testCategorize_ProviderFailures(MetricsProviderException e, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(e));
    }

    // ============================================================================
    // Generic exceptions
    // ============================================================================

    static Stream<Arguments> genericFailures() {
        return Stream.of(
                Arguments.of(new TimeoutException("deadline"), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new RuntimeException("Operation timed out after 60s"), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new ConnectException("refused"), ErrorCategory.NETWORK_ERROR),
                Arguments.of(new ResourceAccessException("I/O error"), ErrorCategory.NETWORK_ERROR),
                Arguments.of(new SQLException("relation does not exist", "42P01"), ErrorCategory.DATABASE_ERROR),
                Arguments.of(new DataAccessResourceFailureException("pool exhausted"), ErrorCategory.DATABASE_ERROR),
                Arguments.of(new IllegalArgumentException("bad weight"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new UnsupportedOperationException("nope"), ErrorCategory.APPLICATION_ERROR)
        );
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("genericFailures")
    @DisplayName("Other exceptions categorize by type, first match wins")
    void testCategorize_GenericFailures(Throwable e, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(e));
    }

    @Test
    @DisplayName("Executor wrappers are looked through")
    void testCategorize_UnwrapsExecutionException() {
        ExecutionException wrapped = new ExecutionException(MetricsProviderException.http(429, "slow down", null));
        assertEquals(ErrorCategory.RATE_LIMITED, ErrorCategory.categorize(wrapped));
    }
}
