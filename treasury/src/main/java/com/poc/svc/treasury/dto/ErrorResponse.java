package com.poc.svc.treasury.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * 所有 /treasury API 共用的錯誤回應。
 */
@Schema(name = "ErrorResponse", description = "資金分析 API 的錯誤回應格式")
public record ErrorResponse(
        @Schema(description = "錯誤代碼", example = "POOL_NOT_FOUND") String code,
        @Schema(description = "錯誤訊息", example = "No active pool found for region APAC") String message,
        @Schema(description = "額外錯誤細節", example = "{\"pool_name\":\"APAC Pool\"}") Map<String, Object> details,
        @Schema(description = "Trace ID", example = "trace-1234") String traceId
) {

    public ErrorResponse {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ErrorResponse of(String code, String message, Map<String, Object> details, String traceId) {
        return new ErrorResponse(code, message, details, traceId);
    }
}
