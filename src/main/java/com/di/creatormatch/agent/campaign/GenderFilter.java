package com.di.creatormatch.agent.campaign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GenderFilter {
    ANY("any"),
    FEMALE("female"),
    MALE("male");

    private final String value;

    GenderFilter(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isSpecified() {
        return this != ANY;
    }

    public GenderFilter opposite() {
        switch (this) {
            case FEMALE:
                return MALE;
            case MALE:
                return FEMALE;
            default:
                return ANY;
        }
    }

    @JsonCreator
    public static GenderFilter fromString(String value) {
        if (value == null || value.isBlank()) return ANY;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (GenderFilter g : values()) {
            if (g.value.equals(v)) return g;
        }
        return ANY;
    }
}
