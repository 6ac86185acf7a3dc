package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a tone finding. Policies written with the legacy {@code hard}/{@code soft}
 * vocabulary map onto {@code fail}/{@code warn}.
 */
public enum ToneSeverity {
    WARN,
    FAIL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ToneSeverity fromWire(String value) {
        if (value == null) {
            return WARN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fail", "hard", "hard_ban" -> FAIL;
            case "warn", "soft", "soft_ban" -> WARN;
            default -> throw new IllegalArgumentException("Unknown tone severity: " + value);
        };
    }
}
