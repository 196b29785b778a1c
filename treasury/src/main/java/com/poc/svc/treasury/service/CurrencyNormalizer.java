package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.FxRate;
import com.poc.svc.treasury.service.impl.DefaultCurrencyNormalizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface CurrencyNormalizer {

    /**
     * Converts {@code amount} from {@code fromCurrency} into {@code toCurrency} using the latest rate dated
     * on or before {@code asOfDate}.
     *
     * @throws com.poc.svc.treasury.exception.MissingRateException when neither the direct nor the inverse pair is quoted
     */
    ConversionResult convert(BigDecimal amount, String fromCurrency, String toCurrency, LocalDate asOfDate);

    boolean hasRatePath(String fromCurrency, String toCurrency, LocalDate asOfDate);

    static CurrencyNormalizer of(List<FxRate> rates) {
        return new DefaultCurrencyNormalizer(FxRateTable.of(rates));
    }

    record ConversionResult(BigDecimal convertedAmount, BigDecimal exchangeRate, LocalDate rateDate) {
    }
}
