package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.NormalizationOutcome;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.service.CurrencyNormalizer;

import java.time.LocalDate;
import java.util.Objects;

public record ValidationContext(
        TreasurySnapshot snapshot,
        NormalizationOutcome outcome,
        CurrencyNormalizer normalizer,
        String reportingCurrency
) {

    public ValidationContext {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(normalizer, "normalizer must not be null");
        Objects.requireNonNull(reportingCurrency, "reportingCurrency must not be null");
    }

    public LocalDate checkDate() {
        return snapshot.asOfDate();
    }

    public boolean hasRatePath(String currency) {
        return normalizer.hasRatePath(currency, reportingCurrency, snapshot.asOfDate());
    }
}
