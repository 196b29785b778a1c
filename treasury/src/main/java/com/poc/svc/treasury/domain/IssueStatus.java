package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueStatus {
    OPEN("Open"),
    RESOLVED("Resolved");

    private final String label;

    IssueStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static IssueStatus fromLabel(String value) {
        for (IssueStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown issue status: " + value);
    }
}
