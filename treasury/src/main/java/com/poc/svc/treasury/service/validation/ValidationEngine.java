package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.config.MetricsConfig;
import com.poc.svc.treasury.domain.ValidationIssue;
import com.poc.svc.treasury.domain.ValidationReport;
import com.poc.svc.treasury.util.TraceContext;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 執行所有檢核規則。單一規則拋出例外時記錄並略過，不影響其他規則。
 */
@Service
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final List<ValidationRule> rules;
    private final MeterRegistry meterRegistry;

    public ValidationEngine(List<ValidationRule> rules, MeterRegistry meterRegistry) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = rules.stream()
                .sorted(Comparator.comparing(ValidationRule::checkType))
                .toList();
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    public ValidationReport validate(ValidationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationRule rule : rules) {
            try {
                Optional<ValidationIssue> issue = rule.evaluate(context);
                issue.ifPresent(issues::add);
            } catch (RuntimeException ex) {
                meterRegistry.counter(MetricsConfig.TREASURY_VALIDATION_RULE_FAILURE,
                        "check_type", rule.checkType().code()).increment();
                log.error("TraceId={} validation rule failed checkType={} asOf={}",
                        TraceContext.traceId(), rule.checkType().code(), context.checkDate(), ex);
            }
        }
        ValidationReport report = ValidationReport.of(issues);
        log.info("TraceId={} asOf={} validationIssues={} bySeverity={}",
                TraceContext.traceId(), context.checkDate(), report.totalIssues(), report.bySeverity());
        return report;
    }

    public int ruleCount() {
        return rules.size();
    }
}
