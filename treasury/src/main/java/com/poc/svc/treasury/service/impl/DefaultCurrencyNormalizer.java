package com.poc.svc.treasury.service.impl;

import com.poc.svc.treasury.exception.MissingRateException;
import com.poc.svc.treasury.service.CurrencyNormalizer;
import com.poc.svc.treasury.service.FxRateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

public class DefaultCurrencyNormalizer implements CurrencyNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DefaultCurrencyNormalizer.class);

    private final FxRateTable rateTable;

    public DefaultCurrencyNormalizer(FxRateTable rateTable) {
        this.rateTable = Objects.requireNonNull(rateTable, "rateTable must not be null");
    }

    @Override
    public ConversionResult convert(BigDecimal amount, String fromCurrency, String toCurrency, LocalDate asOfDate) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (fromCurrency == null || toCurrency == null) {
            throw new IllegalArgumentException("Currency codes must not be null");
        }
        Objects.requireNonNull(asOfDate, "asOfDate must not be null");
        if (fromCurrency.equalsIgnoreCase(toCurrency)) {
            return new ConversionResult(amount, BigDecimal.ONE.setScale(4), asOfDate);
        }
        FxRateTable.Quote quote = resolve(fromCurrency, toCurrency, asOfDate)
                .orElseThrow(() -> {
                    log.warn("Missing conversion rate for {} -> {} asOf={} knownRates={}",
                            fromCurrency, toCurrency, asOfDate, rateTable.size());
                    return new MissingRateException(fromCurrency, toCurrency, asOfDate);
                });
        BigDecimal converted = amount.multiply(quote.rate()).setScale(2, RoundingMode.HALF_UP);
        return new ConversionResult(converted, quote.rate(), quote.rateDate());
    }

    @Override
    public boolean hasRatePath(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        if (fromCurrency == null || toCurrency == null) {
            return false;
        }
        return fromCurrency.equalsIgnoreCase(toCurrency) || resolve(fromCurrency, toCurrency, asOfDate).isPresent();
    }

    private Optional<FxRateTable.Quote> resolve(String fromCurrency, String toCurrency, LocalDate asOfDate) {
        Optional<FxRateTable.Quote> direct = rateTable.find(fromCurrency, toCurrency, asOfDate);
        if (direct.isPresent()) {
            return direct;
        }
        return rateTable.find(toCurrency, fromCurrency, asOfDate)
                .filter(inverse -> inverse.rate().signum() != 0)
                .map(inverse -> new FxRateTable.Quote(
                        BigDecimal.ONE.divide(inverse.rate(), 8, RoundingMode.HALF_UP),
                        inverse.rateDate()));
    }
}
