package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.RoundingMode;
import java.util.Locale;

public enum RoundingRule {
    HALF_UP("half_up", RoundingMode.HALF_UP),
    BANKERS("bankers", RoundingMode.HALF_EVEN);

    private final String wireName;
    private final RoundingMode mode;

    RoundingRule(String wireName, RoundingMode mode) {
        this.wireName = wireName;
        this.mode = mode;
    }

    public RoundingMode mode() {
        return mode;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RoundingRule fromWire(String value) {
        if (value == null) {
            return HALF_UP;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("bankers") || v.equals("half_even")) {
            return BANKERS;
        }
        if (v.equals("half_up")) {
            return HALF_UP;
        }
        throw new IllegalArgumentException("Unknown rounding rule: " + value);
    }
}
