package com.poc.svc.treasury.dto;

import com.poc.svc.treasury.domain.TrendPoint;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.List;

@Schema(name = "LiquidityTrendResponse", description = "區間內每個有餘額日期的流動性總額")
public record LiquidityTrendResponse(LocalDate from, LocalDate to, String reportingCurrency, List<TrendPoint> trends) {
}
