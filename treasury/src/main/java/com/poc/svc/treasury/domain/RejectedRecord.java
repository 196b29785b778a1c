package com.poc.svc.treasury.domain;

import java.util.Objects;

public record RejectedRecord(RecordType recordType, String reference, String reason) {
    public RejectedRecord {
        Objects.requireNonNull(recordType, "recordType must not be null");
        reference = reference == null ? "<unknown>" : reference;
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
