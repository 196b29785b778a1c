package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.util.Objects;

public record ExcludedBalance(
        String accountId,
        String entityCode,
        String region,
        String currency,
        BigDecimal amountLocal,
        ExclusionReason reason,
        String detail
) {
    public ExcludedBalance {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(amountLocal, "amountLocal must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
