package com.example.fundraisingdashboard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Risk classification of an operation. Ordered from least to most dangerous.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }
}
