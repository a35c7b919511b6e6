package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse confidence bucket. Derived from call counts and evidence ratios, not a probability.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
