package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record AnalyticsSummary(
        LocalDate asOfDate,
        String reportingCurrency,
        BigDecimal totalLiquidityReportingCcy,
        int totalAccounts,
        int totalCashPools,
        int activeNettingTransactions,
        int dataQualityIssues,
        Map<String, BigDecimal> regionalBreakdown,
        List<EntityBalance> topEntities
) {
    public AnalyticsSummary {
        regionalBreakdown = regionalBreakdown == null ? Map.of() : regionalBreakdown;
        topEntities = topEntities == null ? List.of() : List.copyOf(topEntities);
    }
}
