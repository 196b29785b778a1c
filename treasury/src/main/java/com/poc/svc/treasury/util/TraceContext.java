package com.poc.svc.treasury.util;

import org.slf4j.MDC;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * Trace ID 存放於 MDC，供日誌與錯誤回應使用；非同步工作透過 {@link #wrap(Runnable)} 延續呼叫端的 Trace ID。
 */
public final class TraceContext {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_MDC_KEY = "traceId";

    private TraceContext() {
    }

    public static String ensureTraceId(String candidate) {
        String traceId = StringUtils.hasText(candidate) ? candidate.trim() : UUID.randomUUID().toString();
        MDC.put(TRACE_ID_MDC_KEY, traceId);
        return traceId;
    }

    public static String currentOrNew() {
        String current = traceId();
        return StringUtils.hasText(current) ? current : ensureTraceId(null);
    }

    public static String traceId() {
        return MDC.get(TRACE_ID_MDC_KEY);
    }

    public static void clear() {
        MDC.remove(TRACE_ID_MDC_KEY);
    }

    public static Runnable wrap(Runnable task) {
        String captured = traceId();
        return () -> {
            String previous = traceId();
            if (StringUtils.hasText(captured)) {
                MDC.put(TRACE_ID_MDC_KEY, captured);
            }
            try {
                task.run();
            } finally {
                if (previous == null) {
                    clear();
                } else {
                    MDC.put(TRACE_ID_MDC_KEY, previous);
                }
            }
        };
    }
}
