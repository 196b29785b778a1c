package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.SettlementLeg;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 貪婪配對：最大的正部位對最大的負部位，直到雙方都落在 epsilon 以內。
 * 同額時依代碼排序，因此相同輸入必得到相同配對順序。
 * <p>
 * 不保證交易筆數最少；至多產生 (參與者數 - 1) 筆。
 */
public class SettlementMatcher {

    private static final Comparator<Map.Entry<String, BigDecimal>> BY_MAGNITUDE =
            Comparator.<Map.Entry<String, BigDecimal>, BigDecimal>comparing(entry -> entry.getValue().abs())
                    .reversed()
                    .thenComparing(Map.Entry::getKey);

    private final BigDecimal epsilon;

    public SettlementMatcher(BigDecimal epsilon) {
        Objects.requireNonNull(epsilon, "epsilon must not be null");
        if (epsilon.signum() < 0) {
            throw new IllegalArgumentException("epsilon must be >= 0");
        }
        this.epsilon = epsilon;
    }

    public BigDecimal epsilon() {
        return epsilon;
    }

    public MatchResult match(Map<String, BigDecimal> netPositions) {
        Objects.requireNonNull(netPositions, "netPositions must not be null");

        List<Slot> creditors = new ArrayList<>();
        List<Slot> debtors = new ArrayList<>();
        SortedMap<String, BigDecimal> unmatched = new TreeMap<>();
        netPositions.entrySet().stream()
                .map(entry -> Map.entry(entry.getKey(), entry.getValue().setScale(2, RoundingMode.HALF_UP)))
                .sorted(BY_MAGNITUDE)
                .forEach(entry -> {
                    BigDecimal value = entry.getValue();
                    if (value.compareTo(epsilon) > 0) {
                        creditors.add(new Slot(entry.getKey(), value));
                    } else if (value.negate().compareTo(epsilon) > 0) {
                        debtors.add(new Slot(entry.getKey(), value.negate()));
                    } else if (value.signum() != 0) {
                        unmatched.put(entry.getKey(), value);
                    }
                });

        List<SettlementLeg> legs = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < creditors.size() && j < debtors.size()) {
            Slot creditor = creditors.get(i);
            Slot debtor = debtors.get(j);
            BigDecimal amount = creditor.remaining.min(debtor.remaining);
            if (amount.compareTo(epsilon) > 0) {
                legs.add(new SettlementLeg(creditor.code, debtor.code, amount));
            }
            creditor.remaining = creditor.remaining.subtract(amount);
            debtor.remaining = debtor.remaining.subtract(amount);
            if (creditor.remaining.compareTo(epsilon) <= 0) {
                i++;
            }
            if (debtor.remaining.compareTo(epsilon) <= 0) {
                j++;
            }
        }

        // whatever is left after the greedy pass stays with its owner
        for (Slot creditor : creditors) {
            if (creditor.remaining.signum() != 0) {
                unmatched.put(creditor.code, creditor.remaining);
            }
        }
        for (Slot debtor : debtors) {
            if (debtor.remaining.signum() != 0) {
                unmatched.put(debtor.code, debtor.remaining.negate());
            }
        }
        return new MatchResult(List.copyOf(legs), Collections.unmodifiableSortedMap(unmatched));
    }

    public record MatchResult(List<SettlementLeg> legs, Map<String, BigDecimal> unmatched) {

        public BigDecimal totalMatched() {
            return legs.stream()
                    .map(SettlementLeg::amount)
                    .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
        }
    }

    private static final class Slot {
        private final String code;
        private BigDecimal remaining;

        private Slot(String code, BigDecimal remaining) {
            this.code = code;
            this.remaining = remaining;
        }
    }
}
