package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PoolType {
    PHYSICAL("Physical"),
    NOTIONAL("Notional");

    private final String label;

    PoolType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static PoolType fromLabel(String value) {
        if (value != null) {
            for (PoolType type : values()) {
                if (type.label.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pool type: " + value);
    }
}
