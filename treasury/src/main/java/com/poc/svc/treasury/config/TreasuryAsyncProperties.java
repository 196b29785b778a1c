package com.poc.svc.treasury.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "treasury.async")
public class TreasuryAsyncProperties {

    @Min(value = 1, message = "treasury.async.thread-pool-size must be >= 1")
    private int threadPoolSize = 4;

    @Min(value = 0, message = "treasury.async.queue-capacity must be >= 0")
    private int queueCapacity = 64;

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
