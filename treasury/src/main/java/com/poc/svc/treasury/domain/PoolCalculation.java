package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record PoolCalculation(
        String poolName,
        PoolType poolType,
        String region,
        LocalDate calculationDate,
        BigDecimal totalPooled,
        BigDecimal averageBalance,
        BigDecimal efficiency,
        int missingParticipants,
        List<PoolParticipant> participants,
        List<PoolTransfer> transfers
) {
    public PoolCalculation {
        participants = participants == null ? List.of() : List.copyOf(participants);
        transfers = transfers == null ? List.of() : List.copyOf(transfers);
    }
}
