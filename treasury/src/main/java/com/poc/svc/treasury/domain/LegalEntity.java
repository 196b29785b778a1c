package com.poc.svc.treasury.domain;

import java.util.Objects;

public record LegalEntity(String entityCode, String name, String country, String region) {
    public LegalEntity {
        Objects.requireNonNull(entityCode, "entityCode must not be null");
    }
}
