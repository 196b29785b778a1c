package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.NettingResult;
import com.poc.svc.treasury.domain.NettingTransaction;
import com.poc.svc.treasury.domain.TransactionStatus;
import com.poc.svc.treasury.domain.TransferScope;
import com.poc.svc.treasury.entity.NettingTransactionDocument;
import com.poc.svc.treasury.exception.NettingTransactionNotFoundException;
import com.poc.svc.treasury.repository.NettingTransactionRepository;
import com.poc.svc.treasury.util.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 軋差結果的稽核副本。同一日期重跑會整批取代，但該日已有交易確認過就拒絕重跑；
 * Pending 交易只能經由 {@link #confirm} 變成 Settled 或 Failed。
 */
@Service
public class NettingAuditService {

    private static final Logger log = LoggerFactory.getLogger(NettingAuditService.class);

    private final NettingTransactionRepository repository;
    private final Clock clock;

    public NettingAuditService(NettingTransactionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public NettingResult record(NettingResult result) {
        Objects.requireNonNull(result, "result must not be null");
        Instant now = Instant.now(clock);
        String traceId = TraceContext.traceId();
        if (repository.existsByNettingDateAndStatusNot(result.nettingDate(), TransactionStatus.PENDING.label())) {
            log.warn("TraceId={} nettingDate={} rerun refused, confirmed transactions exist", traceId, result.nettingDate());
            throw new IllegalStateException("Netting for " + result.nettingDate()
                    + " already has confirmed transactions and cannot be replaced");
        }
        long removed = repository.deleteByNettingDate(result.nettingDate());
        List<NettingTransactionDocument> documents = result.transactions().stream()
                .map(tx -> new NettingTransactionDocument(
                        null,
                        tx.transactionId(),
                        tx.date(),
                        tx.fromEntity(),
                        tx.toEntity(),
                        tx.amount(),
                        tx.currency(),
                        tx.status().label(),
                        tx.scope().name(),
                        now,
                        null,
                        traceId
                ))
                .toList();
        repository.saveAll(documents);
        log.info("TraceId={} nettingDate={} replaced={} recorded={}", traceId, result.nettingDate(), removed, documents.size());
        return result;
    }

    /**
     * @param nettingDate 指定日期；{@code null} 取最近一次軋差
     */
    public NettingResult results(LocalDate nettingDate, String defaultCurrency) {
        LocalDate date = nettingDate;
        if (date == null) {
            date = repository.findTopByOrderByNettingDateDesc()
                    .map(NettingTransactionDocument::nettingDate)
                    .orElse(null);
        }
        if (date == null) {
            return NettingResult.empty(null, defaultCurrency);
        }
        List<NettingTransaction> transactions = repository.findByNettingDateOrderByTransactionIdAsc(date).stream()
                .map(NettingAuditService::toTransaction)
                .toList();
        String currency = transactions.isEmpty() ? defaultCurrency : transactions.get(0).currency();
        return NettingResult.of(date, currency, transactions, Map.of());
    }

    public NettingTransaction confirm(String transactionId, TransactionStatus outcome) {
        Objects.requireNonNull(transactionId, "transactionId must not be null");
        if (outcome != TransactionStatus.SETTLED && outcome != TransactionStatus.FAILED) {
            throw new IllegalArgumentException("Settlement outcome must be Settled or Failed but was " + outcome);
        }
        NettingTransactionDocument document = repository.findByTransactionId(transactionId)
                .orElseThrow(() -> new NettingTransactionNotFoundException(transactionId));
        TransactionStatus current = TransactionStatus.fromLabel(document.status());
        if (current != TransactionStatus.PENDING) {
            throw new IllegalStateException("Netting transaction " + transactionId + " is already " + current.label());
        }
        NettingTransactionDocument saved = repository.save(document.withStatus(outcome.label(), Instant.now(clock)));
        log.info("TraceId={} transactionId={} status={}->{}", TraceContext.traceId(), transactionId,
                current.label(), outcome.label());
        return toTransaction(saved);
    }

    private static NettingTransaction toTransaction(NettingTransactionDocument document) {
        return new NettingTransaction(
                document.transactionId(),
                document.fromEntity(),
                document.toEntity(),
                document.amount(),
                document.currency(),
                document.nettingDate(),
                TransactionStatus.fromLabel(document.status()),
                document.scope() == null ? TransferScope.INTER_COMPANY : TransferScope.valueOf(document.scope())
        );
    }
}
