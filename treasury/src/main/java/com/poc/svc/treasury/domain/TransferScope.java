package com.poc.svc.treasury.domain;

public enum TransferScope {
    INTER_COMPANY,
    INTRA_POOL
}
