package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.NettingResult;
import com.poc.svc.treasury.domain.NettingTransaction;
import com.poc.svc.treasury.domain.TransactionStatus;
import com.poc.svc.treasury.domain.TransferScope;
import com.poc.svc.treasury.entity.NettingTransactionDocument;
import com.poc.svc.treasury.exception.NettingTransactionNotFoundException;
import com.poc.svc.treasury.repository.NettingTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.poc.svc.treasury.TreasuryFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NettingAuditServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-31T09:30:00Z");

    @Mock
    private NettingTransactionRepository repository;

    private NettingAuditService service;

    @BeforeEach
    void setUp() {
        service = new NettingAuditService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @SuppressWarnings("unchecked")
    void record_replacesEarlierRunForSameDate() {
        when(repository.deleteByNettingDate(AS_OF)).thenReturn(3L);
        NettingResult result = NettingResult.of(AS_OF, "USD", List.of(
                transaction("NET-20250331-0001", TransactionStatus.PENDING)), Map.of());

        assertThat(service.record(result)).isSameAs(result);

        ArgumentCaptor<List<NettingTransactionDocument>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        assertThat(saved.getValue()).singleElement().satisfies(document -> {
            assertThat(document.transactionId()).isEqualTo("NET-20250331-0001");
            assertThat(document.status()).isEqualTo("Pending");
            assertThat(document.scope()).isEqualTo("INTER_COMPANY");
            assertThat(document.createdAt()).isEqualTo(NOW);
            assertThat(document.confirmedAt()).isNull();
        });
    }

    @Test
    void record_refusesToReplaceConfirmedRun() {
        when(repository.existsByNettingDateAndStatusNot(AS_OF, "Pending")).thenReturn(true);
        NettingResult rerun = NettingResult.of(AS_OF, "USD", List.of(
                transaction("NET-20250331-0001", TransactionStatus.PENDING)), Map.of());

        assertThatThrownBy(() -> service.record(rerun))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("2025-03-31");
        verify(repository, never()).deleteByNettingDate(any());
        verify(repository, never()).saveAll(any());
    }

    @Test
    void results_defaultsToLatestDate() {
        NettingTransactionDocument latest = document("NET-20250331-0001", "Settled");
        when(repository.findTopByOrderByNettingDateDesc()).thenReturn(Optional.of(latest));
        when(repository.findByNettingDateOrderByTransactionIdAsc(AS_OF)).thenReturn(List.of(latest));

        NettingResult result = service.results(null, "USD");

        assertThat(result.nettingDate()).isEqualTo(AS_OF);
        assertThat(result.totalTransactions()).isEqualTo(1);
        assertThat(result.byStatus()).containsEntry("Settled", 1);
    }

    @Test
    void results_emptyWhenNothingRecorded() {
        when(repository.findTopByOrderByNettingDateDesc()).thenReturn(Optional.empty());

        NettingResult result = service.results(null, "USD");

        assertThat(result.totalTransactions()).isZero();
        assertThat(result.currency()).isEqualTo("USD");
    }

    @Test
    void confirm_settlesPendingTransaction() {
        when(repository.findByTransactionId("NET-20250331-0001"))
                .thenReturn(Optional.of(document("NET-20250331-0001", "Pending")));
        when(repository.save(any(NettingTransactionDocument.class))).thenAnswer(invocation -> invocation.getArgument(0));

        NettingTransaction confirmed = service.confirm("NET-20250331-0001", TransactionStatus.SETTLED);

        assertThat(confirmed.status()).isEqualTo(TransactionStatus.SETTLED);
        ArgumentCaptor<NettingTransactionDocument> saved = ArgumentCaptor.forClass(NettingTransactionDocument.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().confirmedAt()).isEqualTo(NOW);
        assertThat(saved.getValue().id()).isEqualTo("doc-NET-20250331-0001");
    }

    @Test
    void confirm_rejectsSecondConfirmation() {
        when(repository.findByTransactionId("NET-20250331-0001"))
                .thenReturn(Optional.of(document("NET-20250331-0001", "Failed")));

        assertThatThrownBy(() -> service.confirm("NET-20250331-0001", TransactionStatus.SETTLED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already Failed");
        verify(repository, never()).save(any(NettingTransactionDocument.class));
    }

    @Test
    void confirm_unknownTransaction() {
        when(repository.findByTransactionId("NET-X")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.confirm("NET-X", TransactionStatus.FAILED))
                .isInstanceOf(NettingTransactionNotFoundException.class);
    }

    @Test
    void confirm_pendingIsNotAnOutcome() {
        assertThatThrownBy(() -> service.confirm("NET-20250331-0001", TransactionStatus.PENDING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static NettingTransaction transaction(String id, TransactionStatus status) {
        return new NettingTransaction(id, "A", "B", new BigDecimal("100.00"), "USD", AS_OF, status,
                TransferScope.INTER_COMPANY);
    }

    private static NettingTransactionDocument document(String id, String status) {
        return new NettingTransactionDocument("doc-" + id, id, AS_OF, "A", "B", new BigDecimal("100.00"), "USD",
                status, "INTER_COMPANY", NOW.minusSeconds(60), null, "trace-1");
    }
}
