package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Severity fromLabel(String value) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(value) || severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
