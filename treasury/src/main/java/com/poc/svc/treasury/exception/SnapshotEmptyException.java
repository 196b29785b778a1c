package com.poc.svc.treasury.exception;

import java.time.LocalDate;

public class SnapshotEmptyException extends RuntimeException {

    private final LocalDate asOfDate;

    public SnapshotEmptyException(LocalDate asOfDate) {
        super(asOfDate == null
                ? "No cash balances available for any date"
                : "No accounts or cash balances available for " + asOfDate);
        this.asOfDate = asOfDate;
    }

    public LocalDate asOfDate() {
        return asOfDate;
    }
}
