package com.poc.svc.treasury.domain;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issue set of one validation run; the per-severity and per-type counts are views over {@link #issues()}.
 */
public record ValidationReport(
        int totalIssues,
        Map<String, Integer> bySeverity,
        Map<String, Integer> byType,
        List<ValidationIssue> issues
) {
    public ValidationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        bySeverity = bySeverity == null ? Map.of() : bySeverity;
        byType = byType == null ? Map.of() : byType;
    }

    public static ValidationReport of(List<ValidationIssue> issues) {
        List<ValidationIssue> ordered = issues.stream()
                .sorted(Comparator.comparing(ValidationIssue::checkType))
                .toList();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            int count = (int) ordered.stream().filter(issue -> issue.severity() == severity).count();
            if (count > 0) {
                bySeverity.put(severity.label(), count);
            }
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (ValidationIssue issue : ordered) {
            byType.merge(issue.checkType().code(), 1, Integer::sum);
        }
        return new ValidationReport(ordered.size(), bySeverity, byType, ordered);
    }

    public static ValidationReport empty() {
        return of(List.of());
    }
}
