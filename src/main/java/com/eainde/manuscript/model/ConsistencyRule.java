package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConsistencyRule {
    PER_COLUMN("per_column"),
    NONE("none");

    private final String wireName;

    ConsistencyRule(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConsistencyRule fromWire(String value) {
        if (value == null) {
            return PER_COLUMN;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ConsistencyRule rule : values()) {
            if (rule.wireName.equals(v)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown consistency rule: " + value);
    }
}
