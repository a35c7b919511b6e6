package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a recommendation: {@code pending -> applied | dismissed}. Applied and dismissed are terminal.
 */
public enum RecommendationStatus {
    PENDING,
    APPLIED,
    DISMISSED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecommendationStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        for (RecommendationStatus status : values()) {
            if (status.getCode().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown recommendation status: " + code);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(RecommendationStatus next) {
        return this == PENDING && next != null && next != PENDING;
    }
}
