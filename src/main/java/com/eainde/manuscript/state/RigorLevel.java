package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Governance mode of a project: {@code conservative} gates, {@code exploratory} only advises.
 */
public enum RigorLevel {
    CONSERVATIVE,
    EXPLORATORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RigorLevel fromWire(String value) {
        if (value == null || value.isBlank()) {
            return CONSERVATIVE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
