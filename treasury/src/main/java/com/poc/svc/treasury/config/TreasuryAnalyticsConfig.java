package com.poc.svc.treasury.config;

import com.poc.svc.treasury.service.CashPoolOptimizer;
import com.poc.svc.treasury.service.LiquidityAggregator;
import com.poc.svc.treasury.service.NettingEngine;
import com.poc.svc.treasury.service.SettlementMatcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        TreasuryAnalyticsProperties.class,
        NettingProperties.class,
        PoolingProperties.class,
        ValidationProperties.class
})
public class TreasuryAnalyticsConfig {

    @Bean
    public Clock treasuryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LiquidityAggregator liquidityAggregator(TreasuryAnalyticsProperties properties) {
        return new LiquidityAggregator(properties.getReportingCurrency(), properties.getTopEntities());
    }

    @Bean
    public SettlementMatcher settlementMatcher(NettingProperties properties) {
        return new SettlementMatcher(properties.getEpsilon());
    }

    @Bean
    public NettingEngine nettingEngine(SettlementMatcher settlementMatcher, NettingProperties properties) {
        return new NettingEngine(settlementMatcher, properties.getTarget());
    }

    @Bean
    public CashPoolOptimizer cashPoolOptimizer(SettlementMatcher settlementMatcher,
                                               PoolingProperties poolingProperties,
                                               TreasuryAnalyticsProperties analyticsProperties) {
        return new CashPoolOptimizer(
                settlementMatcher,
                poolingProperties.getEfficiencyEpsilon(),
                analyticsProperties.getReportingCurrency()
        );
    }
}
