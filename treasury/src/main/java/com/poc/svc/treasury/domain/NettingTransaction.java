package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

public record NettingTransaction(
        String transactionId,
        String fromEntity,
        String toEntity,
        BigDecimal amount,
        String currency,
        LocalDate date,
        TransactionStatus status,
        TransferScope scope
) {
    public NettingTransaction {
        Objects.requireNonNull(transactionId, "transactionId must not be null");
        Objects.requireNonNull(fromEntity, "fromEntity must not be null");
        Objects.requireNonNull(toEntity, "toEntity must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
    }
}
