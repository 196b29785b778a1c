package com.poc.svc.treasury.domain;

public enum RecordType {
    ACCOUNT,
    BALANCE,
    FX_RATE,
    ENTITY,
    POOL
}
