package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.AnalyticsSummary;
import com.poc.svc.treasury.dto.ErrorResponse;
import com.poc.svc.treasury.dto.LiquidityTrendResponse;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/treasury/analytics")
@Tag(name = "Analytics", description = "儀表板摘要與趨勢")
public class AnalyticsController {

    private final TreasuryAnalyticsService analyticsService;

    public AnalyticsController(TreasuryAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/summary")
    @Operation(
            operationId = "getAnalyticsSummary",
            summary = "Dashboard summary",
            description = "總流動性、帳戶數、資金池數、待結算軋差筆數、未解決檢核數與區域分布。",
            parameters = @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)"),
            responses = @ApiResponse(responseCode = "200", description = "Summary",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = AnalyticsSummary.class)))
    )
    public AnalyticsSummary summary(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.summary(asOf);
    }

    @GetMapping("/trends")
    @Operation(
            operationId = "getLiquidityTrends",
            summary = "Total liquidity per balance date",
            description = "區間內每個有餘額資料的日期各算一次全球部位；沒有餘額的日期略過。",
            parameters = {
                    @Parameter(name = "from", in = ParameterIn.QUERY, required = true, description = "起日 (yyyy-MM-dd)"),
                    @Parameter(name = "to", in = ParameterIn.QUERY, required = true, description = "迄日 (yyyy-MM-dd)")
            },
            responses = {
                    @ApiResponse(responseCode = "200", description = "Trend points",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = LiquidityTrendResponse.class))),
                    @ApiResponse(responseCode = "400", description = "日期區間不合法",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public LiquidityTrendResponse trends(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return new LiquidityTrendResponse(from, to, analyticsService.reportingCurrency(), analyticsService.trends(from, to));
    }
}
