package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.PoolCalculation;
import com.poc.svc.treasury.dto.ErrorResponse;
import com.poc.svc.treasury.dto.PoolStatusResponse;
import com.poc.svc.treasury.service.TreasuryAnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/treasury/cash-pool")
@Tag(name = "Cash Pooling", description = "資金池狀態與盈缺計算")
public class CashPoolController {

    private final TreasuryAnalyticsService analyticsService;

    public CashPoolController(TreasuryAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/status")
    @Operation(
            operationId = "getCashPoolStatus",
            summary = "Status of every configured cash pool",
            description = "設定錯誤的資金池標示為 Invalid 並附上原因，其餘資金池照常計算。",
            parameters = @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)"),
            responses = @ApiResponse(responseCode = "200", description = "Pool statuses",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = PoolStatusResponse.class)))
    )
    public PoolStatusResponse status(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return PoolStatusResponse.of(analyticsService.poolStatus(asOf));
    }

    @PostMapping("/calculate/{region}")
    @Operation(
            operationId = "calculateCashPool",
            summary = "Surplus/deficit calculation for a region's cash pool",
            description = "取該區域名稱排序第一個啟用中的資金池；實體資金池另外回傳歸零調撥。",
            parameters = {
                    @Parameter(name = "region", in = ParameterIn.PATH, required = true, description = "區域代碼"),
                    @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)")
            },
            responses = {
                    @ApiResponse(responseCode = "200", description = "Pool calculation",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = PoolCalculation.class))),
                    @ApiResponse(responseCode = "404", description = "區域內沒有啟用中的資金池",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "422", description = "資金池設定錯誤",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public PoolCalculation calculate(
            @PathVariable String region,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.calculatePool(asOf, region);
    }
}
