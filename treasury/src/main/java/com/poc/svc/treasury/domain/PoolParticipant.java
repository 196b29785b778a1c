package com.poc.svc.treasury.domain;

import java.math.BigDecimal;

public record PoolParticipant(
        String account,
        String entity,
        BigDecimal balance,
        BigDecimal varianceFromAvg,
        ParticipantStatus status
) {
}
