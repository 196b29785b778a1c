package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.util.Objects;

public record NormalizedPosition(
        String accountId,
        String entityCode,
        String region,
        String currency,
        BigDecimal amountLocal,
        BigDecimal amountReporting,
        BigDecimal exchangeRate
) {
    public NormalizedPosition {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(entityCode, "entityCode must not be null");
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(amountLocal, "amountLocal must not be null");
        Objects.requireNonNull(amountReporting, "amountReporting must not be null");
        Objects.requireNonNull(exchangeRate, "exchangeRate must not be null");
    }
}
