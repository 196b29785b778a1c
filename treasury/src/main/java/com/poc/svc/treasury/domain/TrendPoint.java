package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record TrendPoint(LocalDate date, BigDecimal totalLiquidityReportingCcy, Map<String, BigDecimal> byRegion) {
}
