package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.config.ValidationProperties;
import com.poc.svc.treasury.domain.BankAccount;
import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class NegativeCashRule implements ValidationRule {

    private final Set<String> creditAccountTypes;

    public NegativeCashRule(ValidationProperties properties) {
        this.creditAccountTypes = properties.getCreditAccountTypes().stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public CheckType checkType() {
        return CheckType.NEGATIVE_CASH;
    }

    @Override
    public Optional<ValidationIssue> evaluate(ValidationContext context) {
        Map<String, BankAccount> accounts = context.snapshot().accountsById();
        long negative = context.snapshot().balances().stream()
                .filter(balance -> balance.amountLocal().signum() < 0)
                .filter(balance -> !isCreditFacility(accounts.get(balance.accountId())))
                .count();
        if (negative == 0) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.open(
                checkType(),
                Severity.MEDIUM,
                (int) negative,
                "Found %d balances with negative cash outside credit facilities".formatted(negative),
                context.checkDate()
        ));
    }

    private boolean isCreditFacility(BankAccount account) {
        return account != null && creditAccountTypes.contains(account.accountType().trim().toLowerCase(Locale.ROOT));
    }
}
