package com.poc.svc.treasury.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NettingResult(
        LocalDate nettingDate,
        String currency,
        int totalTransactions,
        BigDecimal totalNettedAmount,
        Map<String, Integer> byStatus,
        List<NettingTransaction> transactions,
        Map<String, BigDecimal> unmatched
) {
    public NettingResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        byStatus = byStatus == null ? Map.of() : byStatus;
        unmatched = unmatched == null ? Map.of() : unmatched;
    }

    public static NettingResult of(LocalDate nettingDate, String currency, List<NettingTransaction> transactions,
                                   Map<String, BigDecimal> unmatched) {
        BigDecimal total = transactions.stream()
                .map(NettingTransaction::amount)
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (TransactionStatus status : TransactionStatus.values()) {
            int count = (int) transactions.stream().filter(tx -> tx.status() == status).count();
            if (count > 0) {
                byStatus.put(status.label(), count);
            }
        }
        return new NettingResult(nettingDate, currency, transactions.size(), total, byStatus, transactions, unmatched);
    }

    public static NettingResult empty(LocalDate nettingDate, String currency) {
        return of(nettingDate, currency, List.of(), Map.of());
    }
}
