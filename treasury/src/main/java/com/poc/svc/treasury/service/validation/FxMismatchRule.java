package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.BankAccount;
import com.poc.svc.treasury.domain.CashBalance;
import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 帳戶幣別或餘額幣別無法換算成報表幣別；與 normalizer 排除 MISSING_RATE 的條件相同。
 * affected records 以帳戶數計算。
 */
@Component
public class FxMismatchRule implements ValidationRule {

    @Override
    public CheckType checkType() {
        return CheckType.FX_MISMATCH;
    }

    @Override
    public Optional<ValidationIssue> evaluate(ValidationContext context) {
        SortedSet<String> accounts = new TreeSet<>();
        SortedSet<String> currencies = new TreeSet<>();
        for (BankAccount account : context.snapshot().accounts()) {
            if (account.active() && !context.hasRatePath(account.currency())) {
                accounts.add(account.accountId());
                currencies.add(account.currency());
            }
        }
        for (CashBalance balance : context.snapshot().balances()) {
            if (!context.hasRatePath(balance.currency())) {
                accounts.add(balance.accountId());
                currencies.add(balance.currency());
            }
        }
        if (accounts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.open(
                checkType(),
                Severity.HIGH,
                accounts.size(),
                "Found %d accounts without a %s rate on %s for currencies %s"
                        .formatted(accounts.size(), context.reportingCurrency(), context.checkDate(), currencies),
                context.checkDate()
        ));
    }
}
