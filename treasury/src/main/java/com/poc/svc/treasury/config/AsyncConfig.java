package com.poc.svc.treasury.config;

import com.poc.svc.treasury.util.TraceContext;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 區域彙總與資金池計算共用的執行緒池；工作會帶上呼叫端的 Trace ID。
 */
@Configuration
@EnableConfigurationProperties(TreasuryAsyncProperties.class)
public class AsyncConfig {

    public static final String TREASURY_ASYNC_EXECUTOR = "treasuryAsyncExecutor";

    @Bean(name = TREASURY_ASYNC_EXECUTOR)
    public Executor treasuryAsyncExecutor(TreasuryAsyncProperties properties) {
        ThreadPoolTaskExecutor taskExecutor = new ThreadPoolTaskExecutor();
        int poolSize = properties.getThreadPoolSize();
        taskExecutor.setCorePoolSize(poolSize);
        taskExecutor.setMaxPoolSize(poolSize);
        taskExecutor.setQueueCapacity(properties.getQueueCapacity());
        taskExecutor.setThreadNamePrefix("treasury-async-");
        taskExecutor.setAllowCoreThreadTimeOut(true);
        // 佇列滿時改由呼叫端執行緒執行
        taskExecutor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        taskExecutor.setTaskDecorator(TraceContext::wrap);
        taskExecutor.initialize();
        return taskExecutor;
    }
}
