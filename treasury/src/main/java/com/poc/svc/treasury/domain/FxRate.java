package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * 匯率：一單位 base currency 可兌換的 quote currency 數量，必須大於零。
 */
public record FxRate(
        String baseCurrency,
        String quoteCurrency,
        BigDecimal rate,
        LocalDate rateDate
) {
    public FxRate {
        Objects.requireNonNull(baseCurrency, "baseCurrency must not be null");
        Objects.requireNonNull(quoteCurrency, "quoteCurrency must not be null");
        Objects.requireNonNull(rate, "rate must not be null");
        Objects.requireNonNull(rateDate, "rateDate must not be null");
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("rate must be > 0 for " + baseCurrency + "/" + quoteCurrency);
        }
    }

    public String pair() {
        return baseCurrency + "/" + quoteCurrency;
    }
}
