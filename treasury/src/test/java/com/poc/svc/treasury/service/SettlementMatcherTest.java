package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.SettlementLeg;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettlementMatcherTest {

    private final SettlementMatcher matcher = new SettlementMatcher(new BigDecimal("0.01"));

    @Test
    @DisplayName("largest creditor is matched against largest debtor first")
    void match_greedyOrder() {
        SettlementMatcher.MatchResult result = matcher.match(Map.of(
                "A", new BigDecimal("300"),
                "B", new BigDecimal("-100"),
                "C", new BigDecimal("-200")));

        assertThat(result.legs()).containsExactly(
                new SettlementLeg("A", "C", new BigDecimal("200.00")),
                new SettlementLeg("A", "B", new BigDecimal("100.00")));
        assertThat(result.totalMatched()).isEqualByComparingTo("300");
        assertThat(result.unmatched()).isEmpty();
    }

    @Test
    @DisplayName("equal magnitudes are ordered by code")
    void match_tieBreak() {
        Map<String, BigDecimal> positions = new LinkedHashMap<>();
        positions.put("Z", new BigDecimal("50"));
        positions.put("Y", new BigDecimal("50"));
        positions.put("X", new BigDecimal("-50"));
        positions.put("W", new BigDecimal("-50"));

        SettlementMatcher.MatchResult result = matcher.match(positions);

        assertThat(result.legs()).containsExactly(
                new SettlementLeg("Y", "W", new BigDecimal("50.00")),
                new SettlementLeg("Z", "X", new BigDecimal("50.00")));
    }

    @Test
    @DisplayName("positions within epsilon produce no leg")
    void match_epsilon() {
        SettlementMatcher.MatchResult result = matcher.match(Map.of(
                "A", new BigDecimal("0.01"),
                "B", new BigDecimal("-0.004")));

        assertThat(result.legs()).isEmpty();
        assertThat(result.unmatched()).containsOnlyKeys("A");
    }

    @Test
    @DisplayName("unbalanced input leaves the remainder with its owner")
    void match_unbalanced() {
        SettlementMatcher.MatchResult result = matcher.match(Map.of(
                "A", new BigDecimal("500"),
                "B", new BigDecimal("-120")));

        assertThat(result.legs()).containsExactly(new SettlementLeg("A", "B", new BigDecimal("120.00")));
        assertThat(result.unmatched().get("A")).isEqualByComparingTo("380");
    }

    @Test
    @DisplayName("each participant's legs add up to its net position")
    void match_conservation() {
        Map<String, BigDecimal> positions = Map.of(
                "E1", new BigDecimal("1250.75"),
                "E2", new BigDecimal("-300.25"),
                "E3", new BigDecimal("499.50"),
                "E4", new BigDecimal("-1450.00"),
                "E5", new BigDecimal("0.00"));

        SettlementMatcher.MatchResult result = matcher.match(positions);

        positions.forEach((code, net) -> {
            BigDecimal paid = result.legs().stream().filter(leg -> leg.from().equals(code))
                    .map(SettlementLeg::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal received = result.legs().stream().filter(leg -> leg.to().equals(code))
                    .map(SettlementLeg::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(paid.subtract(received)).as("net for %s", code).isEqualByComparingTo(net);
        });
        assertThat(result.legs()).hasSizeLessThanOrEqualTo(3);
        assertThat(result.legs()).allSatisfy(leg -> assertThat(leg.amount()).isGreaterThan(new BigDecimal("0.01")));
    }

    @Test
    void constructor_rejectsNegativeEpsilon() {
        assertThatThrownBy(() -> new SettlementMatcher(new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
