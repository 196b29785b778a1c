package com.poc.svc.treasury.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    /** 依 operation tag 區分，於 TreasuryAnalyticsService 註冊。 */
    public static final String TREASURY_ANALYTICS_LATENCY = "treasury.analytics.latency";
    public static final String TREASURY_SNAPSHOT_LOAD_LATENCY = "treasury.snapshot.load.latency";
    public static final String TREASURY_NORMALIZATION_EXCLUDED = "treasury.normalization.excluded";
    public static final String TREASURY_SNAPSHOT_REJECTED = "treasury.snapshot.rejected";
    public static final String TREASURY_VALIDATION_RULE_FAILURE = "treasury.validation.rule.failure";
    public static final String TREASURY_POOL_INVALID = "treasury.pool.invalid";
    public static final String TREASURY_NETTING_TRANSACTIONS = "treasury.netting.transactions";

    @Bean
    public Timer treasurySnapshotLoadLatencyTimer(MeterRegistry registry) {
        return Timer.builder(TREASURY_SNAPSHOT_LOAD_LATENCY)
                .description("MongoDB 快照載入耗時 (milliseconds)")
                .publishPercentileHistogram()
                .register(registry);
    }
}
