package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data-quality checks in the order they are reported.
 */
public enum CheckType {
    MISSING_BALANCE("missing_balance"),
    DUPLICATE("duplicate"),
    NEGATIVE_CASH("negative_cash"),
    FX_MISMATCH("fx_mismatch"),
    MALFORMED_RECORD("malformed_record");

    private final String code;

    CheckType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static CheckType fromCode(String value) {
        for (CheckType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown check type: " + value);
    }
}
