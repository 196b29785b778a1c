package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One directed match produced by the greedy matcher: {@code from} holds the surplus and pays {@code to}.
 */
public record SettlementLeg(String from, String to, BigDecimal amount) {
    public SettlementLeg {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
    }
}
