package com.poc.svc.treasury.domain;

import java.util.List;
import java.util.Objects;

public record CashPool(
        String poolName,
        PoolType poolType,
        String region,
        List<String> participantAccountIds,
        boolean active
) {
    public CashPool {
        Objects.requireNonNull(poolName, "poolName must not be null");
        Objects.requireNonNull(poolType, "poolType must not be null");
        Objects.requireNonNull(region, "region must not be null");
        participantAccountIds = participantAccountIds == null ? List.of() : List.copyOf(participantAccountIds);
    }
}
