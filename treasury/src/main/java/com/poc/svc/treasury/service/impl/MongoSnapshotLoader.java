package com.poc.svc.treasury.service.impl;

import com.poc.svc.treasury.config.MetricsConfig;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.entity.CashBalanceDocument;
import com.poc.svc.treasury.exception.SnapshotEmptyException;
import com.poc.svc.treasury.repository.BankAccountRepository;
import com.poc.svc.treasury.repository.CashBalanceRepository;
import com.poc.svc.treasury.repository.CashPoolRepository;
import com.poc.svc.treasury.repository.FxRateRepository;
import com.poc.svc.treasury.repository.LegalEntityRepository;
import com.poc.svc.treasury.service.SnapshotAssembler;
import com.poc.svc.treasury.service.SnapshotLoader;
import com.poc.svc.treasury.util.TraceContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

@Component
public class MongoSnapshotLoader implements SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(MongoSnapshotLoader.class);

    private final BankAccountRepository accountRepository;
    private final CashBalanceRepository balanceRepository;
    private final FxRateRepository fxRateRepository;
    private final LegalEntityRepository entityRepository;
    private final CashPoolRepository poolRepository;
    private final SnapshotAssembler assembler;
    private final MeterRegistry meterRegistry;

    public MongoSnapshotLoader(BankAccountRepository accountRepository,
                               CashBalanceRepository balanceRepository,
                               FxRateRepository fxRateRepository,
                               LegalEntityRepository entityRepository,
                               CashPoolRepository poolRepository,
                               SnapshotAssembler assembler,
                               MeterRegistry meterRegistry) {
        this.accountRepository = accountRepository;
        this.balanceRepository = balanceRepository;
        this.fxRateRepository = fxRateRepository;
        this.entityRepository = entityRepository;
        this.poolRepository = poolRepository;
        this.assembler = assembler;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public TreasurySnapshot load(LocalDate asOfDate) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            LocalDate date = asOfDate != null ? asOfDate : latestBalanceDate();
            List<CashBalanceDocument> balances = balanceRepository.findByBalanceDate(date.toString());
            TreasurySnapshot snapshot = assembler.assemble(date, new SnapshotAssembler.RawSnapshot(
                    accountRepository.findAll(),
                    balances,
                    fxRateRepository.findAll(),
                    entityRepository.findAll(),
                    poolRepository.findAll()
            ));
            if (!snapshot.rejectedRecords().isEmpty()) {
                meterRegistry.counter(MetricsConfig.TREASURY_SNAPSHOT_REJECTED).increment(snapshot.rejectedRecords().size());
            }
            if (snapshot.isEmpty()) {
                throw new SnapshotEmptyException(date);
            }
            log.info("TraceId={} asOf={} accounts={} balances={} fxRates={} pools={} rejected={}",
                    TraceContext.traceId(), date, snapshot.accounts().size(), snapshot.balances().size(),
                    snapshot.fxRates().size(), snapshot.pools().size(), snapshot.rejectedRecords().size());
            return snapshot;
        } finally {
            sample.stop(meterRegistry.timer(MetricsConfig.TREASURY_SNAPSHOT_LOAD_LATENCY));
        }
    }

    @Override
    public SortedSet<LocalDate> availableDates(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        SortedSet<LocalDate> dates = new TreeSet<>();
        for (CashBalanceDocument document : balanceRepository.findBalanceDatesBetween(from.toString(), to.toString())) {
            parseDate(document.balanceDate()).ifPresent(date -> {
                if (!date.isBefore(from) && !date.isAfter(to)) {
                    dates.add(date);
                }
            });
        }
        return dates;
    }

    private LocalDate latestBalanceDate() {
        return balanceRepository.findTopByOrderByBalanceDateDesc()
                .map(CashBalanceDocument::balanceDate)
                .flatMap(this::parseDate)
                .orElseThrow(() -> new SnapshotEmptyException(null));
    }

    private Optional<LocalDate> parseDate(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring balance with unparseable balance_date={}", value);
            return Optional.empty();
        }
    }
}
