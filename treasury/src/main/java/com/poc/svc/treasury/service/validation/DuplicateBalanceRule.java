package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 同一帳戶同一日期出現多筆餘額；affected records 為多出來的筆數。
 */
@Component
public class DuplicateBalanceRule implements ValidationRule {

    @Override
    public CheckType checkType() {
        return CheckType.DUPLICATE;
    }

    @Override
    public Optional<ValidationIssue> evaluate(ValidationContext context) {
        long total = context.snapshot().balances().size();
        long distinct = context.snapshot().balances().stream()
                .map(balance -> balance.accountId() + "|" + balance.balanceDate())
                .distinct()
                .count();
        long duplicates = total - distinct;
        if (duplicates == 0) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.open(
                checkType(),
                Severity.HIGH,
                (int) duplicates,
                "Found %d duplicate account-date combinations".formatted(duplicates),
                context.checkDate()
        ));
    }
}
