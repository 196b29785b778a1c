package com.poc.svc.treasury.service;

import com.poc.svc.treasury.config.AsyncConfig;
import com.poc.svc.treasury.config.MetricsConfig;
import com.poc.svc.treasury.config.NettingProperties;
import com.poc.svc.treasury.config.TreasuryAnalyticsProperties;
import com.poc.svc.treasury.domain.AnalyticsSummary;
import com.poc.svc.treasury.domain.CashPool;
import com.poc.svc.treasury.domain.ExcludedBalance;
import com.poc.svc.treasury.domain.GlobalPosition;
import com.poc.svc.treasury.domain.NettingResult;
import com.poc.svc.treasury.domain.NettingTransaction;
import com.poc.svc.treasury.domain.NormalizationOutcome;
import com.poc.svc.treasury.domain.NormalizedPosition;
import com.poc.svc.treasury.domain.PoolCalculation;
import com.poc.svc.treasury.domain.PoolStatus;
import com.poc.svc.treasury.domain.RegionalPosition;
import com.poc.svc.treasury.domain.TransactionStatus;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.domain.TrendPoint;
import com.poc.svc.treasury.domain.ValidationReport;
import com.poc.svc.treasury.exception.InvalidPoolConfigurationException;
import com.poc.svc.treasury.exception.PoolNotFoundException;
import com.poc.svc.treasury.exception.SnapshotEmptyException;
import com.poc.svc.treasury.service.validation.ValidationContext;
import com.poc.svc.treasury.service.validation.ValidationEngine;
import com.poc.svc.treasury.util.TraceContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 對外的資金分析流程：載入快照，區域彙總與資金池計算平行執行，軋差循序執行。
 * 快照沒有資料時回傳空的有效結果，而不是錯誤。
 */
@Service
public class TreasuryAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(TreasuryAnalyticsService.class);

    private final SnapshotLoader snapshotLoader;
    private final LiquidityAggregator aggregator;
    private final CashPoolOptimizer poolOptimizer;
    private final NettingEngine nettingEngine;
    private final ValidationEngine validationEngine;
    private final NettingAuditService nettingAuditService;
    private final ValidationHistoryService validationHistoryService;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final TreasuryAnalyticsProperties analyticsProperties;
    private final NettingProperties nettingProperties;
    private final Clock clock;

    public TreasuryAnalyticsService(SnapshotLoader snapshotLoader,
                                    LiquidityAggregator aggregator,
                                    CashPoolOptimizer poolOptimizer,
                                    NettingEngine nettingEngine,
                                    ValidationEngine validationEngine,
                                    NettingAuditService nettingAuditService,
                                    ValidationHistoryService validationHistoryService,
                                    @Qualifier(AsyncConfig.TREASURY_ASYNC_EXECUTOR) Executor executor,
                                    MeterRegistry meterRegistry,
                                    TreasuryAnalyticsProperties analyticsProperties,
                                    NettingProperties nettingProperties,
                                    Clock clock) {
        this.snapshotLoader = Objects.requireNonNull(snapshotLoader, "snapshotLoader must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.poolOptimizer = Objects.requireNonNull(poolOptimizer, "poolOptimizer must not be null");
        this.nettingEngine = Objects.requireNonNull(nettingEngine, "nettingEngine must not be null");
        this.validationEngine = Objects.requireNonNull(validationEngine, "validationEngine must not be null");
        this.nettingAuditService = Objects.requireNonNull(nettingAuditService, "nettingAuditService must not be null");
        this.validationHistoryService = Objects.requireNonNull(validationHistoryService, "validationHistoryService must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.analyticsProperties = Objects.requireNonNull(analyticsProperties, "analyticsProperties must not be null");
        this.nettingProperties = Objects.requireNonNull(nettingProperties, "nettingProperties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String reportingCurrency() {
        return aggregator.reportingCurrency();
    }

    public GlobalPosition globalPosition(LocalDate asOfDate) {
        return timed("global_position", () -> analyze(asOfDate)
                .map(analysis -> aggregator.globalPosition(analysis.snapshot(), analysis.outcome()))
                .orElseGet(() -> GlobalPosition.empty(dateOrToday(asOfDate), aggregator.reportingCurrency())));
    }

    public RegionalPosition regionalPosition(LocalDate asOfDate, String region) {
        if (!StringUtils.hasText(region)) {
            throw new IllegalArgumentException("region must not be blank");
        }
        String normalizedRegion = region.trim().toUpperCase(Locale.ROOT);
        return timed("regional_position", () -> analyze(asOfDate)
                .map(analysis -> aggregator.regionalPosition(analysis.snapshot(), analysis.outcome(), normalizedRegion))
                .orElseGet(() -> RegionalPosition.empty(normalizedRegion)));
    }

    public List<PoolStatus> poolStatus(LocalDate asOfDate) {
        return timed("pool_status", () -> analyze(asOfDate)
                .map(this::poolStatuses)
                .orElseGet(List::of));
    }

    public PoolCalculation calculatePool(LocalDate asOfDate, String region) {
        if (!StringUtils.hasText(region)) {
            throw new IllegalArgumentException("region must not be blank");
        }
        String normalizedRegion = region.trim().toUpperCase(Locale.ROOT);
        return timed("pool_calculation", () -> {
            Analysis analysis = analyze(asOfDate)
                    .orElseThrow(() -> new PoolNotFoundException("No pool data available for region " + normalizedRegion));
            CashPool pool = analysis.snapshot().activePools().stream()
                    .filter(candidate -> candidate.region().equals(normalizedRegion))
                    .min(Comparator.comparing(CashPool::poolName))
                    .orElseThrow(() -> new PoolNotFoundException("No active pool found for region " + normalizedRegion));
            InvalidPoolConfigurationException invalid = poolOptimizer
                    .checkConfiguration(analysis.snapshot().pools())
                    .get(pool.poolName());
            if (invalid != null) {
                throw invalid;
            }
            return poolOptimizer.calculate(pool, analysis.outcome().positionsByAccount(), analysis.snapshot().asOfDate());
        });
    }

    public NettingResult runNetting(LocalDate asOfDate) {
        return timed("netting", () -> {
            Optional<Analysis> analysis = analyze(asOfDate);
            if (analysis.isEmpty()) {
                return NettingResult.empty(dateOrToday(asOfDate), aggregator.reportingCurrency());
            }
            TreasurySnapshot snapshot = analysis.get().snapshot();
            Set<String> excludedAccounts = nettingProperties.isExcludePooledAccounts()
                    ? poolOptimizer.physicallyPooledAccounts(snapshot.pools(), poolOptimizer.checkConfiguration(snapshot.pools()))
                    : Set.of();
            NettingResult result = nettingEngine.run(
                    analysis.get().outcome(),
                    excludedAccounts,
                    aggregator.reportingCurrency(),
                    snapshot.asOfDate()
            );
            meterRegistry.counter(MetricsConfig.TREASURY_NETTING_TRANSACTIONS).increment(result.totalTransactions());
            log.info("TraceId={} asOf={} target={} nettingTransactions={} totalNetted={}", TraceContext.traceId(),
                    snapshot.asOfDate(), nettingEngine.target(), result.totalTransactions(), result.totalNettedAmount());
            return nettingAuditService.record(result);
        });
    }

    public NettingResult nettingResults(LocalDate nettingDate) {
        return nettingAuditService.results(nettingDate, aggregator.reportingCurrency());
    }

    public NettingTransaction confirmSettlement(String transactionId, TransactionStatus outcome) {
        return nettingAuditService.confirm(transactionId, outcome);
    }

    public ValidationReport validate(LocalDate asOfDate) {
        return timed("validation", () -> {
            Optional<Analysis> analysis = analyze(asOfDate);
            if (analysis.isEmpty()) {
                return ValidationReport.empty();
            }
            TreasurySnapshot snapshot = analysis.get().snapshot();
            ValidationReport report = validationEngine.validate(new ValidationContext(
                    snapshot,
                    analysis.get().outcome(),
                    CurrencyNormalizer.of(snapshot.fxRates()),
                    aggregator.reportingCurrency()
            ));
            validationHistoryService.record(report, snapshot.asOfDate());
            return report;
        });
    }

    public ValidationReport validationReport() {
        return validationHistoryService.report();
    }

    public AnalyticsSummary summary(LocalDate asOfDate) {
        return timed("summary", () -> {
            int pendingTransactions = (int) nettingAuditService.results(null, aggregator.reportingCurrency())
                    .transactions().stream()
                    .filter(tx -> tx.status() == TransactionStatus.PENDING)
                    .count();
            int openIssues = validationHistoryService.openIssueCount();
            Optional<Analysis> analysis = analyze(asOfDate);
            if (analysis.isEmpty()) {
                return new AnalyticsSummary(dateOrToday(asOfDate), aggregator.reportingCurrency(),
                        BigDecimal.ZERO.setScale(2), 0, 0, pendingTransactions, openIssues, Map.of(), List.of());
            }
            TreasurySnapshot snapshot = analysis.get().snapshot();
            GlobalPosition global = aggregator.globalPosition(snapshot, analysis.get().outcome());
            return new AnalyticsSummary(
                    global.asOfDate(),
                    global.reportingCurrency(),
                    global.totalLiquidityReportingCcy(),
                    global.totalAccounts(),
                    snapshot.pools().size(),
                    pendingTransactions,
                    openIssues,
                    regionalTotals(analysis.get()),
                    aggregator.topEntities(global.byEntity())
            );
        });
    }

    public List<TrendPoint> trends(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > analyticsProperties.getTrendMaxDays()) {
            throw new IllegalArgumentException("Trend range of %d days exceeds the maximum of %d"
                    .formatted(days, analyticsProperties.getTrendMaxDays()));
        }
        return timed("trends", () -> {
            List<TrendPoint> points = new ArrayList<>();
            for (LocalDate date : snapshotLoader.availableDates(from, to)) {
                analyze(date).ifPresent(analysis -> {
                    GlobalPosition position = aggregator.globalPosition(analysis.snapshot(), analysis.outcome());
                    points.add(new TrendPoint(date, position.totalLiquidityReportingCcy(), position.byRegion()));
                });
            }
            return points;
        });
    }

    private List<PoolStatus> poolStatuses(Analysis analysis) {
        List<CashPool> pools = analysis.snapshot().pools().stream()
                .sorted(Comparator.comparing(CashPool::poolName))
                .toList();
        Map<String, InvalidPoolConfigurationException> invalid = poolOptimizer.checkConfiguration(pools);
        if (!invalid.isEmpty()) {
            meterRegistry.counter(MetricsConfig.TREASURY_POOL_INVALID).increment(invalid.size());
        }
        Map<String, NormalizedPosition> positions = analysis.outcome().positionsByAccount();
        List<CompletableFuture<PoolStatus>> futures = pools.stream()
                .map(pool -> CompletableFuture.supplyAsync(() -> {
                    InvalidPoolConfigurationException error = invalid.get(pool.poolName());
                    if (error == null && pool.participantAccountIds().isEmpty()) {
                        error = new InvalidPoolConfigurationException(pool.poolName(),
                                "Pool " + pool.poolName() + " has no participant accounts");
                    }
                    if (error != null) {
                        return poolOptimizer.invalidStatus(pool, error);
                    }
                    PoolCalculation calculation = poolOptimizer.calculate(pool, positions, analysis.snapshot().asOfDate());
                    return poolOptimizer.toStatus(pool, calculation);
                }, executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Map<String, BigDecimal> regionalTotals(Analysis analysis) {
        SortedMap<String, CompletableFuture<RegionalPosition>> futures = new TreeMap<>();
        for (String region : aggregator.regions(analysis.outcome())) {
            futures.put(region, CompletableFuture.supplyAsync(
                    () -> aggregator.regionalPosition(analysis.snapshot(), analysis.outcome(), region), executor));
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        futures.forEach((region, future) -> totals.put(region, future.join().totalReportingCcy()));
        return totals;
    }

    private Optional<Analysis> analyze(LocalDate asOfDate) {
        TreasurySnapshot snapshot;
        try {
            snapshot = snapshotLoader.load(asOfDate);
        } catch (SnapshotEmptyException ex) {
            log.info("TraceId={} asOf={} empty snapshot: {}", TraceContext.traceId(), asOfDate, ex.getMessage());
            return Optional.empty();
        }
        NormalizationOutcome outcome = aggregator.normalize(snapshot);
        for (ExcludedBalance excluded : outcome.excluded()) {
            meterRegistry.counter(MetricsConfig.TREASURY_NORMALIZATION_EXCLUDED, "reason", excluded.reason().name()).increment();
        }
        return Optional.of(new Analysis(snapshot, outcome));
    }

    private LocalDate dateOrToday(LocalDate asOfDate) {
        return asOfDate != null ? asOfDate : LocalDate.now(clock);
    }

    private <T> T timed(String operation, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return body.get();
        } finally {
            sample.stop(Timer.builder(MetricsConfig.TREASURY_ANALYTICS_LATENCY)
                    .tag("operation", operation)
                    .publishPercentileHistogram()
                    .register(meterRegistry));
        }
    }

    private record Analysis(TreasurySnapshot snapshot, NormalizationOutcome outcome) {
    }
}
