package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.FxRate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rates indexed by pair and date. Built per snapshot and discarded with it.
 */
public final class FxRateTable {

    private final Map<String, NavigableMap<LocalDate, BigDecimal>> ratesByPair;

    private FxRateTable(Map<String, NavigableMap<LocalDate, BigDecimal>> ratesByPair) {
        this.ratesByPair = ratesByPair;
    }

    public static FxRateTable of(List<FxRate> rates) {
        Map<String, NavigableMap<LocalDate, BigDecimal>> index = new HashMap<>();
        // same pair quoted twice on one date: the smallest rate wins, independent of input order
        rates.stream()
                .sorted(Comparator.comparing(FxRate::pair)
                        .thenComparing(FxRate::rateDate)
                        .thenComparing(FxRate::rate))
                .forEach(rate -> index
                        .computeIfAbsent(key(rate.baseCurrency(), rate.quoteCurrency()), ignored -> new TreeMap<>())
                        .putIfAbsent(rate.rateDate(), rate.rate()));
        return new FxRateTable(index);
    }

    public Optional<Quote> find(String baseCurrency, String quoteCurrency, LocalDate asOfDate) {
        NavigableMap<LocalDate, BigDecimal> series = ratesByPair.get(key(baseCurrency, quoteCurrency));
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, BigDecimal> entry = series.floorEntry(asOfDate);
        return entry == null ? Optional.empty() : Optional.of(new Quote(entry.getValue(), entry.getKey()));
    }

    public int size() {
        return ratesByPair.values().stream().mapToInt(Map::size).sum();
    }

    private static String key(String baseCurrency, String quoteCurrency) {
        return normalize(baseCurrency) + "/" + normalize(quoteCurrency);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    public record Quote(BigDecimal rate, LocalDate rateDate) {
    }
}
