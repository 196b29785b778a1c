package com.poc.svc.treasury.domain;

import java.util.Objects;

public record BankAccount(
        String accountId,
        String entityCode,
        String currency,
        String region,
        String accountType,
        boolean active
) {
    public BankAccount {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(entityCode, "entityCode must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(region, "region must not be null");
        accountType = accountType == null ? "" : accountType;
    }
}
