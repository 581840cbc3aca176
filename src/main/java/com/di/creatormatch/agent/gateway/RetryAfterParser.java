package com.di.creatormatch.agent.gateway;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses a {@code Retry-After} header given either as delta-seconds or as an HTTP date.
 */
public final class RetryAfterParser {

    private RetryAfterParser() {
    }

    /** Returns the delay, or null when the header is absent or unparseable. Dates in the past yield zero. */
    public static Duration parse(String headerValue, Clock clock) {
        if (headerValue == null || headerValue.isBlank()) return null;
        String value = headerValue.trim();
        try {
            double seconds = Double.parseDouble(value);
            if (seconds < 0) return Duration.ZERO;
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException ignored) {
            // not delta-seconds, try HTTP date
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delta = Duration.between(clock.instant(), at.toInstant());
            return delta.isNegative() ? Duration.ZERO : delta;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
