package com.poc.svc.treasury.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PoolStatus(
        String poolName,
        PoolType poolType,
        String region,
        BigDecimal totalBalanceReportingCcy,
        int participants,
        @JsonProperty("efficiency_0_to_100") BigDecimal efficiency,
        String status,
        String error
) {
    public static final String ACTIVE = "Active";
    public static final String INACTIVE = "Inactive";
    public static final String INVALID = "Invalid";
}
