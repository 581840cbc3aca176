package com.di.creatormatch.agent.creator;

import java.util.Locale;

/**
 * Social platforms the metrics provider covers. {@code code} is the provider's {@code platform_type}.
 */
public enum Platform {
    INSTAGRAM(2),
    TIKTOK(6);

    private final int code;

    Platform(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Whether the provider reports an audience credibility score for this platform. */
    public boolean reportsCredibility() {
        return this == INSTAGRAM;
    }

    /**
     * Lenient parse: accepts enum name in any case; null/blank/unknown falls back to {@link #INSTAGRAM}.
     */
    public static Platform fromString(String value) {
        if (value == null || value.isBlank()) return INSTAGRAM;
        try {
            return Platform.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INSTAGRAM;
        }
    }
}
