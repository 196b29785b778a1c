package com.poc.svc.treasury.exception;

import java.time.LocalDate;

public class MissingRateException extends RuntimeException {

    private final String baseCurrency;
    private final String quoteCurrency;
    private final LocalDate asOfDate;

    public MissingRateException(String baseCurrency, String quoteCurrency, LocalDate asOfDate) {
        super("Missing conversion rate for %s/%s on or before %s".formatted(baseCurrency, quoteCurrency, asOfDate));
        this.baseCurrency = baseCurrency;
        this.quoteCurrency = quoteCurrency;
        this.asOfDate = asOfDate;
    }

    public String pair() {
        return baseCurrency + "/" + quoteCurrency;
    }

    public String baseCurrency() {
        return baseCurrency;
    }

    public String quoteCurrency() {
        return quoteCurrency;
    }

    public LocalDate asOfDate() {
        return asOfDate;
    }
}
