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
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.poc.svc.treasury.TreasuryFixtures.AS_OF;
import static com.poc.svc.treasury.TreasuryFixtures.pool;
import static com.poc.svc.treasury.TreasuryFixtures.position;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CashPoolOptimizerTest {

    private final CashPoolOptimizer optimizer = new CashPoolOptimizer(
            new SettlementMatcher(new BigDecimal("0.01")), new BigDecimal("0.000001"), "USD");

    @Test
    void calculate_equalBalancesScoreFullEfficiency() {
        CashPool pool = pool("APAC Physical", PoolType.PHYSICAL, "APAC", "P1", "P2", "P3");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("P1", "SG01", "APAC", "100"),
                position("P2", "HK01", "APAC", "100"),
                position("P3", "JP01", "APAC", "100")), AS_OF);

        assertThat(calculation.efficiency()).isEqualByComparingTo("100");
        assertThat(calculation.totalPooled()).isEqualByComparingTo("300");
        assertThat(calculation.averageBalance()).isEqualByComparingTo("100");
        assertThat(calculation.transfers()).isEmpty();
        assertThat(calculation.missingParticipants()).isZero();
    }

    @Test
    void calculate_spreadBalancesScoreBelowFull() {
        CashPool pool = pool("APAC Physical", PoolType.PHYSICAL, "APAC", "P1", "P2", "P3");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("P1", "SG01", "APAC", "0"),
                position("P2", "HK01", "APAC", "100"),
                position("P3", "JP01", "APAC", "200")), AS_OF);

        // population stddev of 0/100/200 is 81.65, so the score is 100 * (1 - 0.8165)
        assertThat(calculation.efficiency()).isEqualByComparingTo("18.35");
        assertThat(calculation.participants())
                .extracting(PoolParticipant::account, PoolParticipant::status)
                .containsExactly(
                        tuple("P1", ParticipantStatus.DEFICIT),
                        tuple("P2", ParticipantStatus.SURPLUS),
                        tuple("P3", ParticipantStatus.SURPLUS));
        assertThat(calculation.participants().get(0).varianceFromAvg()).isEqualByComparingTo("-100");
    }

    @Test
    void calculate_physicalPoolSweepsSurplusIntoDeficit() {
        CashPool pool = pool("APAC Physical", PoolType.PHYSICAL, "APAC", "P1", "P2", "P3");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("P1", "SG01", "APAC", "0"),
                position("P2", "HK01", "APAC", "100"),
                position("P3", "JP01", "APAC", "200")), AS_OF);

        assertThat(calculation.transfers()).containsExactly(
                new PoolTransfer("P3", "P1", new BigDecimal("100.00"), "USD", TransferScope.INTRA_POOL));
    }

    @Test
    void calculate_notionalPoolHasNoTransfers() {
        CashPool pool = pool("EMEA Notional", PoolType.NOTIONAL, "EMEA", "N1", "N2");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("N1", "DE01", "EMEA", "-500"),
                position("N2", "FR01", "EMEA", "1500")), AS_OF);

        assertThat(calculation.transfers()).isEmpty();
        assertThat(calculation.efficiency()).isBetween(BigDecimal.ZERO, new BigDecimal("100"));
    }

    @Test
    void calculate_negativeMeanUsesMagnitude() {
        CashPool pool = pool("Overdrawn", PoolType.NOTIONAL, "EMEA", "N1", "N2");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("N1", "DE01", "EMEA", "-100"),
                position("N2", "FR01", "EMEA", "-100")), AS_OF);

        assertThat(calculation.efficiency()).isEqualByComparingTo("100");
    }

    @Test
    void calculate_countsParticipantsWithoutPosition() {
        CashPool pool = pool("APAC Physical", PoolType.PHYSICAL, "APAC", "P1", "P2", "GONE");

        PoolCalculation calculation = optimizer.calculate(pool, positions(
                position("P1", "SG01", "APAC", "100"),
                position("P2", "HK01", "APAC", "300")), AS_OF);

        assertThat(calculation.missingParticipants()).isEqualTo(1);
        assertThat(calculation.participants()).hasSize(2);
        assertThat(calculation.averageBalance()).isEqualByComparingTo("200");
    }

    @Test
    void calculate_noMatchingPositionsGivesZeros() {
        CashPool pool = pool("APAC Physical", PoolType.PHYSICAL, "APAC", "P1");

        PoolCalculation calculation = optimizer.calculate(pool, Map.of(), AS_OF);

        assertThat(calculation.totalPooled()).isEqualByComparingTo("0");
        assertThat(calculation.efficiency()).isEqualByComparingTo("0");
        assertThat(calculation.missingParticipants()).isEqualTo(1);
    }

    @Test
    void calculate_rejectsPoolWithoutParticipants() {
        CashPool pool = pool("Empty", PoolType.PHYSICAL, "APAC");

        assertThatThrownBy(() -> optimizer.calculate(pool, Map.of(), AS_OF))
                .isInstanceOf(InvalidPoolConfigurationException.class)
                .hasMessageContaining("Empty");
    }

    @Test
    void checkConfiguration_flagsEmptyAndOverlappingPools() {
        List<CashPool> pools = List.of(
                pool("Alpha", PoolType.PHYSICAL, "APAC", "SHARED", "A1"),
                pool("Beta", PoolType.NOTIONAL, "APAC", "SHARED", "B1"),
                pool("Gamma", PoolType.PHYSICAL, "EMEA", "G1"),
                pool("Empty", PoolType.NOTIONAL, "EMEA"),
                new CashPool("Dormant", PoolType.PHYSICAL, "EMEA", List.of("G1"), false));

        Map<String, InvalidPoolConfigurationException> invalid = optimizer.checkConfiguration(pools);

        assertThat(invalid).containsOnlyKeys("Alpha", "Beta", "Empty");
        assertThat(invalid.get("Alpha").getMessage()).contains("SHARED");
        assertThat(invalid.get("Beta").poolName()).isEqualTo("Beta");
        assertThat(optimizer.physicallyPooledAccounts(pools, invalid)).containsExactly("G1");
    }

    @Test
    void statuses() {
        CashPool active = pool("Gamma", PoolType.PHYSICAL, "EMEA", "G1");
        PoolCalculation calculation = optimizer.calculate(active, positions(position("G1", "DE01", "EMEA", "10")), AS_OF);

        PoolStatus status = optimizer.toStatus(active, calculation);
        assertThat(status.status()).isEqualTo(PoolStatus.ACTIVE);
        assertThat(status.participants()).isEqualTo(1);
        assertThat(status.error()).isNull();

        PoolStatus invalid = optimizer.invalidStatus(active, new InvalidPoolConfigurationException("Gamma", "broken"));
        assertThat(invalid.status()).isEqualTo(PoolStatus.INVALID);
        assertThat(invalid.error()).isEqualTo("broken");
        assertThat(invalid.totalBalanceReportingCcy()).isEqualByComparingTo("0");
    }

    @Test
    void efficiency_isClamped() {
        assertThat(optimizer.efficiency(new BigDecimal("10"), new BigDecimal("50"))).isEqualByComparingTo("0");
        assertThat(optimizer.efficiency(BigDecimal.ZERO, BigDecimal.ZERO)).isEqualByComparingTo("100");
    }

    private static Map<String, NormalizedPosition> positions(NormalizedPosition... positions) {
        return Stream.of(positions).collect(Collectors.toMap(NormalizedPosition::accountId, p -> p));
    }
}
