package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.BankAccount;
import com.poc.svc.treasury.domain.CashBalance;
import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class MissingBalanceRule implements ValidationRule {

    @Override
    public CheckType checkType() {
        return CheckType.MISSING_BALANCE;
    }

    @Override
    public Optional<ValidationIssue> evaluate(ValidationContext context) {
        Set<String> withBalance = context.snapshot().balances().stream()
                .map(CashBalance::accountId)
                .collect(Collectors.toSet());
        long missing = context.snapshot().accounts().stream()
                .filter(BankAccount::active)
                .map(BankAccount::accountId)
                .distinct()
                .filter(accountId -> !withBalance.contains(accountId))
                .count();
        if (missing == 0) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.open(
                checkType(),
                Severity.HIGH,
                (int) missing,
                "Found %d active accounts without a balance on %s".formatted(missing, context.checkDate()),
                context.checkDate()
        ));
    }
}
