package com.poc.svc.treasury.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "treasury.analytics")
public class TreasuryAnalyticsProperties {

    @NotBlank
    @Pattern(regexp = "[A-Z]{3}", message = "treasury.analytics.reporting-currency must be an ISO 4217 code")
    private String reportingCurrency = "USD";

    @Min(value = 1, message = "treasury.analytics.top-entities must be >= 1")
    private int topEntities = 5;

    @Min(value = 1, message = "treasury.analytics.trend-max-days must be >= 1")
    @Max(value = 366, message = "treasury.analytics.trend-max-days must be <= 366")
    private int trendMaxDays = 92;

    public String getReportingCurrency() {
        return reportingCurrency;
    }

    public void setReportingCurrency(String reportingCurrency) {
        this.reportingCurrency = reportingCurrency;
    }

    public int getTopEntities() {
        return topEntities;
    }

    public void setTopEntities(int topEntities) {
        this.topEntities = topEntities;
    }

    public int getTrendMaxDays() {
        return trendMaxDays;
    }

    public void setTrendMaxDays(int trendMaxDays) {
        this.trendMaxDays = trendMaxDays;
    }
}
