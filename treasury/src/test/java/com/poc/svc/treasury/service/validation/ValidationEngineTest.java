package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.config.MetricsConfig;
import com.poc.svc.treasury.config.ValidationProperties;
import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.IssueStatus;
import com.poc.svc.treasury.domain.RecordType;
import com.poc.svc.treasury.domain.RejectedRecord;
import com.poc.svc.treasury.domain.Severity;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.domain.ValidationIssue;
import com.poc.svc.treasury.domain.ValidationReport;
import com.poc.svc.treasury.service.CurrencyNormalizer;
import com.poc.svc.treasury.service.LiquidityAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.poc.svc.treasury.TreasuryFixtures.AS_OF;
import static com.poc.svc.treasury.TreasuryFixtures.account;
import static com.poc.svc.treasury.TreasuryFixtures.balance;
import static com.poc.svc.treasury.TreasuryFixtures.rate;
import static com.poc.svc.treasury.TreasuryFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

class ValidationEngineTest {

    private final LiquidityAggregator aggregator = new LiquidityAggregator("USD", 5);

    private SimpleMeterRegistry meterRegistry;
    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = new ValidationEngine(defaultRules(), meterRegistry);
    }

    @Test
    void validate_cleanSnapshotHasNoIssues() {
        TreasurySnapshot clean = snapshot()
                .holding("ACC-1", "SG01", "USD", "APAC", "1000")
                .holding("ACC-2", "DE01", "EUR", "EMEA", "500")
                .rate(rate("EUR", "USD", "1.10"))
                .build();

        ValidationReport report = engine.validate(context(clean));

        assertThat(report.totalIssues()).isZero();
        assertThat(report.issues()).isEmpty();
        assertThat(engine.ruleCount()).isEqualTo(5);
    }

    @Test
    void validate_missingRateIsHighFxMismatch() {
        TreasurySnapshot snapshot = snapshot()
                .holding("ACC-1", "SG01", "USD", "APAC", "1000")
                .holding("ACC-9", "ZZ01", "XYZ", "APAC", "50")
                .build();

        ValidationReport report = engine.validate(context(snapshot));

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.checkType()).isEqualTo(CheckType.FX_MISMATCH);
            assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            assertThat(issue.affectedRecords()).isEqualTo(1);
            assertThat(issue.description()).contains("XYZ");
            assertThat(issue.checkDate()).isEqualTo(AS_OF);
            assertThat(issue.status()).isEqualTo(IssueStatus.OPEN);
        });
        assertThat(report.bySeverity()).containsEntry("High", 1);
        assertThat(report.byType()).containsEntry("fx_mismatch", 1);
    }

    @Test
    void validate_reportsEveryCheckInOrder() {
        TreasurySnapshot snapshot = snapshot()
                .holding("ACC-1", "SG01", "USD", "APAC", "1000")
                .balance(balance("ACC-1", "USD", "1000"))
                .account(account("ACC-2", "SG01", "USD", "APAC"))
                .holding("ACC-3", "SG01", "USD", "APAC", "-20")
                .rejected(new RejectedRecord(RecordType.BALANCE, "ACC-7@2025-03-31", "Non-numeric balance_local 'abc'"))
                .build();

        ValidationReport report = engine.validate(context(snapshot));

        assertThat(report.issues())
                .extracting(ValidationIssue::checkType)
                .containsExactly(CheckType.MISSING_BALANCE, CheckType.DUPLICATE, CheckType.NEGATIVE_CASH,
                        CheckType.MALFORMED_RECORD);
        assertThat(report.issues()).extracting(ValidationIssue::affectedRecords).containsExactly(1, 1, 1, 1);
        assertThat(report.bySeverity()).containsEntry("High", 2).containsEntry("Medium", 2);
    }

    @Test
    void validate_sameSnapshotSameReport() {
        TreasurySnapshot snapshot = snapshot()
                .holding("ACC-1", "SG01", "USD", "APAC", "-5")
                .account(account("ACC-2", "SG01", "USD", "APAC"))
                .build();

        assertThat(engine.validate(context(snapshot))).isEqualTo(engine.validate(context(snapshot)));
    }

    @Test
    void validate_failingRuleDoesNotStopOthers() {
        ValidationRule broken = new ValidationRule() {
            @Override
            public CheckType checkType() {
                return CheckType.DUPLICATE;
            }

            @Override
            public Optional<ValidationIssue> evaluate(ValidationContext context) {
                throw new IllegalStateException("boom");
            }
        };
        ValidationEngine partial = new ValidationEngine(List.of(broken, new MissingBalanceRule()), meterRegistry);
        TreasurySnapshot snapshot = snapshot()
                .holding("ACC-1", "SG01", "USD", "APAC", "1")
                .account(account("ACC-2", "SG01", "USD", "APAC"))
                .build();

        ValidationReport report = partial.validate(context(snapshot));

        assertThat(report.issues()).extracting(ValidationIssue::checkType).containsExactly(CheckType.MISSING_BALANCE);
        assertThat(meterRegistry.counter(MetricsConfig.TREASURY_VALIDATION_RULE_FAILURE, "check_type", "duplicate").count())
                .isEqualTo(1.0);
    }

    private ValidationContext context(TreasurySnapshot snapshot) {
        return new ValidationContext(snapshot, aggregator.normalize(snapshot), CurrencyNormalizer.of(snapshot.fxRates()), "USD");
    }

    private static List<ValidationRule> defaultRules() {
        return List.of(
                new MalformedRecordRule(),
                new FxMismatchRule(),
                new NegativeCashRule(new ValidationProperties()),
                new DuplicateBalanceRule(),
                new MissingBalanceRule());
    }
}
