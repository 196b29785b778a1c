package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record RegionalPosition(
        String region,
        BigDecimal totalReportingCcy,
        int accountCount,
        Map<String, BigDecimal> entities,
        Map<String, BigDecimal> currencies,
        List<EntityBalance> topEntities
) {
    public RegionalPosition {
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(totalReportingCcy, "totalReportingCcy must not be null");
        entities = entities == null ? Map.of() : entities;
        currencies = currencies == null ? Map.of() : currencies;
        topEntities = topEntities == null ? List.of() : List.copyOf(topEntities);
    }

    public static RegionalPosition empty(String region) {
        return new RegionalPosition(region, BigDecimal.ZERO.setScale(2), 0, Map.of(), Map.of(), List.of());
    }
}
