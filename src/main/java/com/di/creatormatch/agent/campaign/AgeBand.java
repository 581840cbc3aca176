package com.di.creatormatch.agent.campaign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audience age bands as labelled by the metrics provider.
 */
public enum AgeBand {
    AGE_13_17("13-17"),
    AGE_18_24("18-24"),
    AGE_25_34("25-34"),
    AGE_35_44("35-44"),
    AGE_45_54("45-54"),
    AGE_55_PLUS("55+");

    private final String label;

    AgeBand(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Returns the band for a provider label, or null when the label is not a known band. */
    @JsonCreator
    public static AgeBand fromLabel(String label) {
        if (label == null) return null;
        String trimmed = label.trim();
        for (AgeBand band : values()) {
            if (band.label.equals(trimmed)) return band;
        }
        if ("65+".equals(trimmed) || "55-64".equals(trimmed)) return AGE_55_PLUS;
        return null;
    }
}
