package com.poc.svc.treasury.domain;

public enum ExclusionReason {
    MISSING_RATE,
    DUPLICATE_BALANCE
}
