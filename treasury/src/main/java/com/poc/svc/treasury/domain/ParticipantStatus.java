package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantStatus {
    SURPLUS("Surplus"),
    DEFICIT("Deficit");

    private final String label;

    ParticipantStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
