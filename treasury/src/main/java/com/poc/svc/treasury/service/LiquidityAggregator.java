package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.BankAccount;
import com.poc.svc.treasury.domain.CashBalance;
import com.poc.svc.treasury.domain.EntityBalance;
import com.poc.svc.treasury.domain.ExcludedBalance;
import com.poc.svc.treasury.domain.ExclusionReason;
import com.poc.svc.treasury.domain.GlobalPosition;
import com.poc.svc.treasury.domain.NormalizationOutcome;
import com.poc.svc.treasury.domain.NormalizedPosition;
import com.poc.svc.treasury.domain.RegionalPosition;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.exception.MissingRateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * 將快照中的現金餘額換算為報表幣別，並依區域、幣別、法人彙總。
 * 所有加總都先依 account id 排序，確保相同輸入得到相同結果。
 */
public class LiquidityAggregator {

    private static final Logger log = LoggerFactory.getLogger(LiquidityAggregator.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    static final Comparator<CashBalance> CANONICAL_ORDER = Comparator.comparing(CashBalance::accountId)
            .thenComparing(CashBalance::currency)
            .thenComparing(CashBalance::amountLocal);

    private final String reportingCurrency;
    private final int topEntities;

    public LiquidityAggregator(String reportingCurrency, int topEntities) {
        if (!StringUtils.hasText(reportingCurrency)) {
            throw new IllegalArgumentException("reportingCurrency must not be blank");
        }
        if (topEntities < 1) {
            throw new IllegalArgumentException("topEntities must be >= 1");
        }
        this.reportingCurrency = reportingCurrency.trim().toUpperCase(Locale.ROOT);
        this.topEntities = topEntities;
    }

    public String reportingCurrency() {
        return reportingCurrency;
    }

    public NormalizationOutcome normalize(TreasurySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        CurrencyNormalizer normalizer = CurrencyNormalizer.of(snapshot.fxRates());
        Map<String, BankAccount> accounts = snapshot.accountsById();

        List<NormalizedPosition> positions = new ArrayList<>();
        List<ExcludedBalance> excluded = new ArrayList<>();
        Set<String> seenAccounts = new HashSet<>();

        List<CashBalance> ordered = snapshot.balances().stream().sorted(CANONICAL_ORDER).toList();
        for (CashBalance balance : ordered) {
            BankAccount account = accounts.get(balance.accountId());
            if (account == null) {
                // the snapshot boundary drops orphan balances; guard against hand-built snapshots
                log.warn("Skipping balance for unknown account={}", balance.accountId());
                continue;
            }
            if (!seenAccounts.add(balance.accountId())) {
                excluded.add(exclude(balance, account, ExclusionReason.DUPLICATE_BALANCE,
                        "Duplicate balance for account " + balance.accountId() + " on " + balance.balanceDate()));
                continue;
            }
            try {
                CurrencyNormalizer.ConversionResult result = normalizer.convert(
                        balance.amountLocal(), balance.currency(), reportingCurrency, snapshot.asOfDate());
                positions.add(new NormalizedPosition(
                        account.accountId(),
                        account.entityCode(),
                        account.region(),
                        balance.currency(),
                        balance.amountLocal(),
                        result.convertedAmount(),
                        result.exchangeRate()
                ));
            } catch (MissingRateException ex) {
                excluded.add(exclude(balance, account, ExclusionReason.MISSING_RATE, ex.getMessage()));
            }
        }
        if (!excluded.isEmpty()) {
            log.info("asOf={} normalized={} excluded={}", snapshot.asOfDate(), positions.size(), excluded.size());
        }
        return new NormalizationOutcome(positions, excluded);
    }

    public GlobalPosition globalPosition(TreasurySnapshot snapshot) {
        return globalPosition(snapshot, normalize(snapshot));
    }

    public GlobalPosition globalPosition(TreasurySnapshot snapshot, NormalizationOutcome outcome) {
        SortedMap<String, BigDecimal> byRegion = new TreeMap<>();
        SortedMap<String, BigDecimal> byEntity = new TreeMap<>();
        BigDecimal total = ZERO;
        for (NormalizedPosition position : outcome.positions()) {
            total = total.add(position.amountReporting());
            byRegion.merge(position.region(), position.amountReporting(), BigDecimal::add);
            byEntity.merge(position.entityCode(), position.amountReporting(), BigDecimal::add);
        }
        return new GlobalPosition(
                snapshot.asOfDate(),
                reportingCurrency,
                total,
                Collections.unmodifiableSortedMap(byRegion),
                Collections.unmodifiableSortedMap(localByCurrency(outcome, null)),
                Collections.unmodifiableSortedMap(byEntity),
                countAccounts(outcome, null),
                outcome.excluded(),
                snapshot.rejectedRecords().size()
        );
    }

    public RegionalPosition regionalPosition(TreasurySnapshot snapshot, NormalizationOutcome outcome, String region) {
        Objects.requireNonNull(region, "region must not be null");
        SortedMap<String, BigDecimal> byEntity = new TreeMap<>();
        BigDecimal total = ZERO;
        for (NormalizedPosition position : outcome.positions()) {
            if (!region.equalsIgnoreCase(position.region())) {
                continue;
            }
            total = total.add(position.amountReporting());
            byEntity.merge(position.entityCode(), position.amountReporting(), BigDecimal::add);
        }
        int accountCount = countAccounts(outcome, region);
        if (accountCount == 0) {
            return RegionalPosition.empty(region);
        }
        return new RegionalPosition(
                region,
                total,
                accountCount,
                Collections.unmodifiableSortedMap(byEntity),
                Collections.unmodifiableSortedMap(localByCurrency(outcome, region)),
                rankEntities(byEntity, topEntities)
        );
    }

    public SortedSet<String> regions(NormalizationOutcome outcome) {
        SortedSet<String> regions = new TreeSet<>();
        outcome.positions().forEach(position -> regions.add(position.region()));
        outcome.excludedFor(ExclusionReason.MISSING_RATE).forEach(balance -> regions.add(balance.region()));
        return regions;
    }

    public List<EntityBalance> topEntities(Map<String, BigDecimal> entityTotals) {
        return rankEntities(entityTotals, topEntities);
    }

    static List<EntityBalance> rankEntities(Map<String, BigDecimal> entityTotals, int limit) {
        return entityTotals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey()))
                .limit(limit)
                .map(entry -> new EntityBalance(entry.getKey(), entry.getValue()))
                .toList();
    }

    // local amounts stay un-converted, so balances without a rate still count here
    private SortedMap<String, BigDecimal> localByCurrency(NormalizationOutcome outcome, String region) {
        SortedMap<String, BigDecimal> byCurrency = new TreeMap<>();
        outcome.positions().stream()
                .filter(position -> region == null || region.equalsIgnoreCase(position.region()))
                .forEach(position -> byCurrency.merge(position.currency(), position.amountLocal(), BigDecimal::add));
        outcome.excludedFor(ExclusionReason.MISSING_RATE).stream()
                .filter(balance -> region == null || region.equalsIgnoreCase(balance.region()))
                .forEach(balance -> byCurrency.merge(balance.currency(), balance.amountLocal(), BigDecimal::add));
        return byCurrency;
    }

    private int countAccounts(NormalizationOutcome outcome, String region) {
        return (int) Stream.concat(
                        outcome.positions().stream()
                                .filter(position -> region == null || region.equalsIgnoreCase(position.region()))
                                .map(NormalizedPosition::accountId),
                        outcome.excludedFor(ExclusionReason.MISSING_RATE).stream()
                                .filter(balance -> region == null || region.equalsIgnoreCase(balance.region()))
                                .map(ExcludedBalance::accountId))
                .distinct()
                .count();
    }

    private ExcludedBalance exclude(CashBalance balance, BankAccount account, ExclusionReason reason, String detail) {
        return new ExcludedBalance(
                balance.accountId(),
                account.entityCode(),
                account.region(),
                balance.currency(),
                balance.amountLocal(),
                reason,
                detail
        );
    }
}
