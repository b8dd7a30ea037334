package com.sprintreport.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a sprint as reported by the issue tracker.
 *
 * UNKNOWN covers missing or unrecognized values so that TTL resolution
 * always has something to work with.
 */
public enum SprintState {

    ACTIVE,
    CLOSED,
    FUTURE,
    UNKNOWN;

    @JsonCreator
    public static SprintState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
