package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record GlobalPosition(
        LocalDate asOfDate,
        String reportingCurrency,
        BigDecimal totalLiquidityReportingCcy,
        Map<String, BigDecimal> byRegion,
        Map<String, BigDecimal> byCurrency,
        Map<String, BigDecimal> byEntity,
        int totalAccounts,
        List<ExcludedBalance> excludedRecords,
        int rejectedRecords
) {
    public GlobalPosition {
        Objects.requireNonNull(reportingCurrency, "reportingCurrency must not be null");
        Objects.requireNonNull(totalLiquidityReportingCcy, "totalLiquidityReportingCcy must not be null");
        byRegion = byRegion == null ? Map.of() : byRegion;
        byCurrency = byCurrency == null ? Map.of() : byCurrency;
        byEntity = byEntity == null ? Map.of() : byEntity;
        excludedRecords = excludedRecords == null ? List.of() : List.copyOf(excludedRecords);
    }

    public static GlobalPosition empty(LocalDate asOfDate, String reportingCurrency) {
        return new GlobalPosition(asOfDate, reportingCurrency, BigDecimal.ZERO.setScale(2), Map.of(), Map.of(), Map.of(), 0, List.of(), 0);
    }
}
