package com.poc.svc.treasury.domain;

import java.time.LocalDate;
import java.util.Objects;

public record ValidationIssue(
        CheckType checkType,
        Severity severity,
        int affectedRecords,
        String description,
        LocalDate checkDate,
        IssueStatus status
) {
    public ValidationIssue {
        Objects.requireNonNull(checkType, "checkType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (affectedRecords < 0) {
            throw new IllegalArgumentException("affectedRecords must be >= 0");
        }
    }

    public static ValidationIssue open(CheckType checkType, Severity severity, int affectedRecords,
                                       String description, LocalDate checkDate) {
        return new ValidationIssue(checkType, severity, affectedRecords, description, checkDate, IssueStatus.OPEN);
    }
}
