package com.poc.svc.treasury.dto;

import com.poc.svc.treasury.domain.PoolStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "PoolStatusResponse", description = "所有資金池的狀態")
public record PoolStatusResponse(List<PoolStatus> pools, int totalPools) {

    public static PoolStatusResponse of(List<PoolStatus> pools) {
        return new PoolStatusResponse(List.copyOf(pools), pools.size());
    }
}
