package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.RecordType;
import com.poc.svc.treasury.domain.RejectedRecord;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 快照組裝時被拒絕的原始紀錄。
 */
@Component
public class MalformedRecordRule implements ValidationRule {

    @Override
    public CheckType checkType() {
        return CheckType.MALFORMED_RECORD;
    }

    @Override
    public Optional<ValidationIssue> evaluate(ValidationContext context) {
        if (context.snapshot().rejectedRecords().isEmpty()) {
            return Optional.empty();
        }
        Map<RecordType, Integer> byType = new TreeMap<>();
        for (RejectedRecord rejected : context.snapshot().rejectedRecords()) {
            byType.merge(rejected.recordType(), 1, Integer::sum);
        }
        int affected = context.snapshot().rejectedRecords().size();
        return Optional.of(ValidationIssue.open(
                checkType(),
                Severity.MEDIUM,
                affected,
                "Rejected %d malformed records %s".formatted(affected, byType),
                context.checkDate()
        ));
    }
}
