package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

public record CashBalance(
        String accountId,
        LocalDate balanceDate,
        String currency,
        BigDecimal amountLocal
) {
    public CashBalance {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(balanceDate, "balanceDate must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(amountLocal, "amountLocal must not be null");
    }
}
