package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.IssueStatus;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.ValidationIssue;
import com.poc.svc.treasury.domain.ValidationReport;
import com.poc.svc.treasury.entity.ValidationLogDocument;
import com.poc.svc.treasury.repository.ValidationLogRepository;
import com.poc.svc.treasury.util.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 檢核紀錄以 check type 加檢核日期為鍵：再次偵測到就原地更新，未再偵測到的 Open 紀錄改為 Resolved。
 * 檢核較早的日期不會影響其他日期的紀錄。
 * 只有檢核執行會關閉 issue，沒有手動關閉的路徑。
 */
@Service
public class ValidationHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ValidationHistoryService.class);

    private final ValidationLogRepository repository;
    private final Clock clock;

    public ValidationHistoryService(ValidationLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void record(ValidationReport report, LocalDate checkDate) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(checkDate, "checkDate must not be null");
        Instant now = Instant.now(clock);
        Map<CheckType, ValidationIssue> detected = new EnumMap<>(CheckType.class);
        report.issues().forEach(issue -> detected.put(issue.checkType(), issue));

        int resolved = 0;
        for (CheckType checkType : CheckType.values()) {
            Optional<ValidationLogDocument> existing = repository.findByCheckTypeAndCheckDate(checkType.code(), checkDate);
            ValidationIssue issue = detected.get(checkType);
            if (issue != null) {
                repository.save(new ValidationLogDocument(
                        existing.map(ValidationLogDocument::id).orElse(null),
                        checkType.code(),
                        issue.severity().label(),
                        issue.description(),
                        issue.affectedRecords(),
                        issue.checkDate(),
                        IssueStatus.OPEN.label(),
                        existing.filter(doc -> IssueStatus.OPEN.label().equals(doc.status()))
                                .map(ValidationLogDocument::firstDetectedAt)
                                .orElse(now),
                        now
                ));
            } else if (existing.isPresent() && IssueStatus.OPEN.label().equals(existing.get().status())) {
                ValidationLogDocument open = existing.get();
                repository.save(new ValidationLogDocument(
                        open.id(),
                        open.checkType(),
                        open.severity(),
                        open.description(),
                        open.affectedRecords(),
                        checkDate,
                        IssueStatus.RESOLVED.label(),
                        open.firstDetectedAt(),
                        now
                ));
                resolved++;
            }
        }
        log.info("TraceId={} checkDate={} open={} resolved={}", TraceContext.traceId(), checkDate, detected.size(), resolved);
    }

    /**
     * 目前保存的所有檢核紀錄，包含已 Resolved 的項目。
     */
    public ValidationReport report() {
        List<ValidationIssue> issues = repository.findAll().stream()
                .map(ValidationHistoryService::toIssue)
                .toList();
        return ValidationReport.of(issues);
    }

    public int openIssueCount() {
        return repository.findByStatus(IssueStatus.OPEN.label()).size();
    }

    private static ValidationIssue toIssue(ValidationLogDocument document) {
        return new ValidationIssue(
                CheckType.fromCode(document.checkType()),
                Severity.fromLabel(document.severity()),
                document.affectedRecords(),
                document.description(),
                document.checkDate(),
                IssueStatus.fromLabel(document.status())
        );
    }
}
