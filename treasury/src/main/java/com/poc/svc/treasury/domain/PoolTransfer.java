package com.poc.svc.treasury.domain;

import java.math.BigDecimal;

public record PoolTransfer(
        String fromAccount,
        String toAccount,
        BigDecimal amount,
        String currency,
        TransferScope scope
) {
}
