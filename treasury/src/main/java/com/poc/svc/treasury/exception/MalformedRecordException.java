package com.poc.svc.treasury.exception;

import com.poc.svc.treasury.domain.RecordType;

public class MalformedRecordException extends RuntimeException {

    private final RecordType recordType;
    private final String reference;

    public MalformedRecordException(RecordType recordType, String reference, String message) {
        super(message);
        this.recordType = recordType;
        this.reference = reference;
    }

    public MalformedRecordException(RecordType recordType, String reference, String message, Throwable cause) {
        super(message, cause);
        this.recordType = recordType;
        this.reference = reference;
    }

    public RecordType recordType() {
        return recordType;
    }

    public String reference() {
        return reference;
    }
}
