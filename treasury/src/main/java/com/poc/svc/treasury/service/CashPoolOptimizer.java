package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.CashPool;
import com.poc.svc.treasury.domain.NormalizedPosition;
import com.poc.svc.treasury.domain.ParticipantStatus;
import com.poc.svc.treasury.domain.PoolCalculation;
import com.poc.svc.treasury.domain.PoolParticipant;
import com.poc.svc.treasury.domain.PoolStatus;
import com.poc.svc.treasury.domain.PoolTransfer;
import com.poc.svc.treasury.domain.PoolType;
import com.poc.svc.treasury.domain.TransferScope;
import com.poc.svc.treasury.exception.InvalidPoolConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 資金池計算：參與者相對平均值的盈缺、集中效率分數，以及實體資金池的歸零調撥。
 */
public class CashPoolOptimizer {

    private static final Logger log = LoggerFactory.getLogger(CashPoolOptimizer.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final SettlementMatcher matcher;
    private final BigDecimal efficiencyEpsilon;
    private final String reportingCurrency;

    public CashPoolOptimizer(SettlementMatcher matcher, BigDecimal efficiencyEpsilon, String reportingCurrency) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.efficiencyEpsilon = Objects.requireNonNull(efficiencyEpsilon, "efficiencyEpsilon must not be null");
        this.reportingCurrency = Objects.requireNonNull(reportingCurrency, "reportingCurrency must not be null");
        if (efficiencyEpsilon.signum() <= 0) {
            throw new IllegalArgumentException("efficiencyEpsilon must be > 0");
        }
    }

    /**
     * 檢查啟用中的資金池設定。回傳 poolName 對應的錯誤；未列出的資金池皆為有效。
     * 同一帳戶出現在多個啟用資金池時，所有相關資金池都視為無效。
     */
    public Map<String, InvalidPoolConfigurationException> checkConfiguration(List<CashPool> pools) {
        Map<String, InvalidPoolConfigurationException> invalid = new TreeMap<>();
        Map<String, Set<String>> poolsByAccount = new TreeMap<>();
        for (CashPool pool : pools) {
            if (!pool.active()) {
                continue;
            }
            if (pool.participantAccountIds().isEmpty()) {
                invalid.put(pool.poolName(), new InvalidPoolConfigurationException(
                        pool.poolName(), "Pool " + pool.poolName() + " has no participant accounts"));
                continue;
            }
            for (String accountId : pool.participantAccountIds()) {
                poolsByAccount.computeIfAbsent(accountId, ignored -> new LinkedHashSet<>()).add(pool.poolName());
            }
        }
        poolsByAccount.forEach((accountId, poolNames) -> {
            if (poolNames.size() < 2) {
                return;
            }
            for (String poolName : poolNames) {
                invalid.putIfAbsent(poolName, new InvalidPoolConfigurationException(
                        poolName, "Account " + accountId + " participates in multiple active pools " + poolNames));
            }
        });
        if (!invalid.isEmpty()) {
            log.warn("Invalid pool configuration pools={}", invalid.keySet());
        }
        return invalid;
    }

    public PoolCalculation calculate(CashPool pool, Map<String, NormalizedPosition> positionsByAccount, LocalDate calculationDate) {
        Objects.requireNonNull(pool, "pool must not be null");
        Objects.requireNonNull(positionsByAccount, "positionsByAccount must not be null");
        if (pool.participantAccountIds().isEmpty()) {
            throw new InvalidPoolConfigurationException(pool.poolName(), "Pool " + pool.poolName() + " has no participant accounts");
        }

        SortedMap<String, NormalizedPosition> members = new TreeMap<>();
        int missing = 0;
        for (String accountId : new LinkedHashSet<>(pool.participantAccountIds())) {
            NormalizedPosition position = positionsByAccount.get(accountId);
            if (position == null) {
                missing++;
            } else {
                members.put(accountId, position);
            }
        }
        if (missing > 0) {
            log.info("pool={} missingParticipants={}", pool.poolName(), missing);
        }

        BigDecimal total = members.values().stream()
                .map(NormalizedPosition::amountReporting)
                .reduce(ZERO, BigDecimal::add);
        if (members.isEmpty()) {
            return new PoolCalculation(pool.poolName(), pool.poolType(), pool.region(), calculationDate,
                    ZERO, ZERO, ZERO, missing, List.of(), List.of());
        }

        BigDecimal count = BigDecimal.valueOf(members.size());
        BigDecimal mean = total.divide(count, MathContext.DECIMAL64);
        BigDecimal average = mean.setScale(2, RoundingMode.HALF_UP);

        List<PoolParticipant> participants = new ArrayList<>(members.size());
        Map<String, BigDecimal> variances = new LinkedHashMap<>();
        BigDecimal squaredDeviations = BigDecimal.ZERO;
        for (NormalizedPosition position : members.values()) {
            BigDecimal balance = position.amountReporting();
            BigDecimal variance = balance.subtract(average);
            squaredDeviations = squaredDeviations.add(balance.subtract(mean).pow(2));
            variances.put(position.accountId(), variance);
            participants.add(new PoolParticipant(
                    position.accountId(),
                    position.entityCode(),
                    balance,
                    variance,
                    variance.signum() >= 0 ? ParticipantStatus.SURPLUS : ParticipantStatus.DEFICIT
            ));
        }
        BigDecimal stddev = squaredDeviations.divide(count, MathContext.DECIMAL64).sqrt(MathContext.DECIMAL64);

        List<PoolTransfer> transfers = pool.poolType() == PoolType.PHYSICAL
                ? zeroBalancingTransfers(variances)
                : List.of();

        return new PoolCalculation(
                pool.poolName(),
                pool.poolType(),
                pool.region(),
                calculationDate,
                total,
                average,
                efficiency(mean, stddev),
                missing,
                participants,
                transfers
        );
    }

    public PoolStatus toStatus(CashPool pool, PoolCalculation calculation) {
        return new PoolStatus(
                pool.poolName(),
                pool.poolType(),
                pool.region(),
                calculation.totalPooled(),
                pool.participantAccountIds().size(),
                calculation.efficiency(),
                pool.active() ? PoolStatus.ACTIVE : PoolStatus.INACTIVE,
                null
        );
    }

    public PoolStatus invalidStatus(CashPool pool, InvalidPoolConfigurationException error) {
        return new PoolStatus(
                pool.poolName(),
                pool.poolType(),
                pool.region(),
                ZERO,
                pool.participantAccountIds().size(),
                ZERO,
                PoolStatus.INVALID,
                error.getMessage()
        );
    }

    /**
     * 有效且啟用的實體資金池帳戶；這些帳戶的資金已由資金池調撥，不再參與法人間軋差。
     */
    public Set<String> physicallyPooledAccounts(List<CashPool> pools, Map<String, InvalidPoolConfigurationException> invalid) {
        Set<String> accounts = new LinkedHashSet<>();
        pools.stream()
                .filter(CashPool::active)
                .filter(pool -> pool.poolType() == PoolType.PHYSICAL)
                .filter(pool -> !invalid.containsKey(pool.poolName()))
                .forEach(pool -> accounts.addAll(pool.participantAccountIds()));
        return accounts;
    }

    BigDecimal efficiency(BigDecimal mean, BigDecimal stddev) {
        BigDecimal denominator = mean.abs().add(efficiencyEpsilon);
        BigDecimal ratio = stddev.divide(denominator, MathContext.DECIMAL64);
        BigDecimal score = HUNDRED.multiply(BigDecimal.ONE.subtract(ratio));
        if (score.signum() < 0) {
            return ZERO;
        }
        if (score.compareTo(HUNDRED) > 0) {
            return HUNDRED.setScale(2);
        }
        return score.setScale(2, RoundingMode.HALF_UP);
    }

    private List<PoolTransfer> zeroBalancingTransfers(Map<String, BigDecimal> variances) {
        return matcher.match(variances).legs().stream()
                .map(leg -> new PoolTransfer(leg.from(), leg.to(), leg.amount(), reportingCurrency, TransferScope.INTRA_POOL))
                .toList();
    }
}
