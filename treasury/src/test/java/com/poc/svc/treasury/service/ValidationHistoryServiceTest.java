package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.IssueStatus;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import com.poc.svc.treasury.domain.ValidationReport;
import com.poc.svc.treasury.entity.ValidationLogDocument;
import com.poc.svc.treasury.repository.ValidationLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.poc.svc.treasury.TreasuryFixtures.AS_OF;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ValidationHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2025-04-01T08:00:00Z");
    private static final Instant EARLIER = Instant.parse("2025-03-30T08:00:00Z");

    @Mock
    private ValidationLogRepository repository;

    private ValidationHistoryService service;

    @BeforeEach
    void setUp() {
        service = new ValidationHistoryService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_updatesOpenIssueInPlaceAndResolvesTheRest() {
        when(repository.findByCheckTypeAndCheckDate("duplicate", AS_OF)).thenReturn(Optional.of(
                new ValidationLogDocument("log-dup", "duplicate", "High", "old", 4, AS_OF,
                        "Open", EARLIER, EARLIER)));
        when(repository.findByCheckTypeAndCheckDate("negative_cash", AS_OF)).thenReturn(Optional.of(
                new ValidationLogDocument("log-neg", "negative_cash", "Medium", "old", 2, AS_OF,
                        "Open", EARLIER, EARLIER)));
        ValidationReport report = ValidationReport.of(List.of(
                ValidationIssue.open(CheckType.DUPLICATE, Severity.HIGH, 1, "Found 1 duplicate", AS_OF)));

        service.record(report, AS_OF);

        ArgumentCaptor<ValidationLogDocument> saved = ArgumentCaptor.forClass(ValidationLogDocument.class);
        verify(repository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).satisfiesExactly(
                duplicate -> {
                    assertThat(duplicate.id()).isEqualTo("log-dup");
                    assertThat(duplicate.affectedRecords()).isEqualTo(1);
                    assertThat(duplicate.status()).isEqualTo("Open");
                    assertThat(duplicate.firstDetectedAt()).isEqualTo(EARLIER);
                    assertThat(duplicate.updatedAt()).isEqualTo(NOW);
                },
                negative -> {
                    assertThat(negative.id()).isEqualTo("log-neg");
                    assertThat(negative.status()).isEqualTo("Resolved");
                    assertThat(negative.checkDate()).isEqualTo(AS_OF);
                });
    }

    @Test
    void record_reopenedIssueStartsNewDetection() {
        when(repository.findByCheckTypeAndCheckDate("fx_mismatch", AS_OF)).thenReturn(Optional.of(
                new ValidationLogDocument("log-fx", "fx_mismatch", "High", "old", 1, AS_OF,
                        "Resolved", EARLIER, EARLIER)));
        ValidationReport report = ValidationReport.of(List.of(
                ValidationIssue.open(CheckType.FX_MISMATCH, Severity.HIGH, 2, "Found 2 accounts", AS_OF)));

        service.record(report, AS_OF);

        ArgumentCaptor<ValidationLogDocument> saved = ArgumentCaptor.forClass(ValidationLogDocument.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().id()).isEqualTo("log-fx");
        assertThat(saved.getValue().firstDetectedAt()).isEqualTo(NOW);
    }

    @Test
    void record_olderCheckDateLeavesLatestIssuesOpen() {
        LocalDate older = AS_OF.minusDays(1);
        when(repository.findByCheckTypeAndCheckDate(anyString(), eq(older))).thenReturn(Optional.empty());

        service.record(ValidationReport.empty(), older);

        verify(repository, never()).findByCheckTypeAndCheckDate(anyString(), eq(AS_OF));
        verify(repository, never()).save(any(ValidationLogDocument.class));
    }

    @Test
    void record_cleanRunWithNoHistoryWritesNothing() {
        service.record(ValidationReport.empty(), AS_OF);

        verify(repository, times(0)).save(any(ValidationLogDocument.class));
    }

    @Test
    void report_includesResolvedIssues() {
        when(repository.findAll()).thenReturn(List.of(
                new ValidationLogDocument("1", "negative_cash", "Medium", "neg", 2, AS_OF, "Resolved", EARLIER, NOW),
                new ValidationLogDocument("2", "missing_balance", "High", "missing", 3, AS_OF, "Open", EARLIER, NOW)));

        ValidationReport report = service.report();

        assertThat(report.totalIssues()).isEqualTo(2);
        assertThat(report.issues()).extracting(ValidationIssue::checkType)
                .containsExactly(CheckType.MISSING_BALANCE, CheckType.NEGATIVE_CASH);
        assertThat(report.issues()).extracting(ValidationIssue::status)
                .containsExactly(IssueStatus.OPEN, IssueStatus.RESOLVED);
    }

    @Test
    void openIssueCount() {
        when(repository.findByStatus("Open")).thenReturn(List.of(
                new ValidationLogDocument("2", "missing_balance", "High", "missing", 3, AS_OF, "Open", EARLIER, NOW)));

        assertThat(service.openIssueCount()).isEqualTo(1);
    }
}
