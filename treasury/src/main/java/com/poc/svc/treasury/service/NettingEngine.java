package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.NettingResult;
import com.poc.svc.treasury.domain.NettingTarget;
import com.poc.svc.treasury.domain.NettingTransaction;
import com.poc.svc.treasury.domain.NormalizationOutcome;
import com.poc.svc.treasury.domain.SettlementLeg;
import com.poc.svc.treasury.domain.TransactionStatus;
import com.poc.svc.treasury.domain.TransferScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 多邊軋差：以法人淨部位為輸入，產生一組同幣別的 Pending 交易。
 * 配對迴圈本身是循序的，不可拆成平行執行。
 */
public class NettingEngine {

    private static final Logger log = LoggerFactory.getLogger(NettingEngine.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final SettlementMatcher matcher;
    private final NettingTarget target;

    public NettingEngine(SettlementMatcher matcher, NettingTarget target) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public NettingTarget target() {
        return target;
    }

    /**
     * 依法人彙總報表幣別金額，排除 {@code excludedAccounts}，再依設定的 target 調整。
     */
    public SortedMap<String, BigDecimal> netPositions(NormalizationOutcome outcome, Set<String> excludedAccounts) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Set<String> excluded = excludedAccounts == null ? Set.of() : excludedAccounts;

        SortedMap<String, BigDecimal> byEntity = new TreeMap<>();
        outcome.positions().stream()
                .filter(position -> !excluded.contains(position.accountId()))
                .forEach(position -> byEntity.merge(position.entityCode(), position.amountReporting(), BigDecimal::add));

        if (target == NettingTarget.AVERAGE && !byEntity.isEmpty()) {
            BigDecimal total = byEntity.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal average = total.divide(BigDecimal.valueOf(byEntity.size()), 2, RoundingMode.HALF_UP);
            byEntity.replaceAll((entity, balance) -> balance.subtract(average));
        }
        return byEntity;
    }

    public NettingResult net(Map<String, BigDecimal> netPositions, String currency, LocalDate nettingDate) {
        Objects.requireNonNull(netPositions, "netPositions must not be null");
        Objects.requireNonNull(currency, "currency must not be null");
        Objects.requireNonNull(nettingDate, "nettingDate must not be null");

        SettlementMatcher.MatchResult match = matcher.match(netPositions);
        List<NettingTransaction> transactions = new ArrayList<>(match.legs().size());
        String datePart = nettingDate.format(ID_DATE);
        int sequence = 1;
        for (SettlementLeg leg : match.legs()) {
            transactions.add(new NettingTransaction(
                    "NET-%s-%04d".formatted(datePart, sequence++),
                    leg.from(),
                    leg.to(),
                    leg.amount(),
                    currency,
                    nettingDate,
                    TransactionStatus.PENDING,
                    TransferScope.INTER_COMPANY
            ));
        }
        if (!match.unmatched().isEmpty()) {
            log.info("date={} currency={} unmatchedEntities={}", nettingDate, currency, match.unmatched().keySet());
        }
        return NettingResult.of(nettingDate, currency, transactions, Collections.unmodifiableMap(match.unmatched()));
    }

    public NettingResult run(NormalizationOutcome outcome, Set<String> excludedAccounts, String currency, LocalDate nettingDate) {
        return net(netPositions(outcome, excludedAccounts), currency, nettingDate);
    }
}
