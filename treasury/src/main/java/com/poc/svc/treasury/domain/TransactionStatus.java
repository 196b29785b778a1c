package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionStatus {
    PENDING("Pending"),
    SETTLED("Settled"),
    FAILED("Failed");

    private final String label;

    TransactionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static TransactionStatus fromLabel(String value) {
        if (value != null) {
            for (TransactionStatus status : values()) {
                if (status.label.equalsIgnoreCase(value.trim()) || status.name().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown transaction status: " + value);
    }
}
