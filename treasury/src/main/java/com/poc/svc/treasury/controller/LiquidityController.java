package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.GlobalPosition;
import com.poc.svc.treasury.domain.RegionalPosition;
import com.poc.svc.treasury.dto.ErrorResponse;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/treasury/liquidity")
@Tag(name = "Liquidity", description = "全球與區域流動性部位")
public class LiquidityController {

    private final TreasuryAnalyticsService analyticsService;

    public LiquidityController(TreasuryAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/global-position")
    @Operation(
            operationId = "getGlobalPosition",
            summary = "Global cash position in the reporting currency",
            description = "依 as-of 日期換算所有帳戶餘額並依區域、幣別、法人彙總；缺匯率的餘額列於 excluded_records。",
            parameters = @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false,
                    description = "快照日期 (yyyy-MM-dd)，未提供時使用最新餘額日期"),
            responses = {
                    @ApiResponse(responseCode = "200", description = "Global position",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = GlobalPosition.class))),
                    @ApiResponse(responseCode = "400", description = "日期格式錯誤",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public GlobalPosition globalPosition(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.globalPosition(asOf);
    }

    @GetMapping("/by-region/{region}")
    @Operation(
            operationId = "getRegionalPosition",
            summary = "Liquidity rollup for one region",
            description = "區域內的法人、幣別分布與前 N 大法人。",
            parameters = {
                    @Parameter(name = "region", in = ParameterIn.PATH, required = true, description = "APAC、EMEA、AMER 等區域代碼"),
                    @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)")
            },
            responses = @ApiResponse(responseCode = "200", description = "Regional position",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = RegionalPosition.class)))
    )
    public RegionalPosition regionalPosition(
            @PathVariable String region,
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.regionalPosition(asOf, region);
    }
}
