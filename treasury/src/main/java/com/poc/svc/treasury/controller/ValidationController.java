package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.ValidationReport;
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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/treasury")
@Tag(name = "Data Validation", description = "資料品質檢核")
public class ValidationController {

    private final TreasuryAnalyticsService analyticsService;

    public ValidationController(TreasuryAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping("/validate")
    @Operation(
            operationId = "runValidation",
            summary = "Run every data-quality rule against a snapshot",
            description = "回傳本次偵測到的 issue；保存的紀錄依 check type 更新，未再偵測到者改為 Resolved。",
            parameters = @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)"),
            responses = @ApiResponse(responseCode = "200", description = "Validation report",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ValidationReport.class)))
    )
    public ValidationReport validate(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.validate(asOf);
    }

    @GetMapping("/validation/report")
    @Operation(
            operationId = "getValidationReport",
            summary = "Persisted validation issues including resolved ones",
            responses = @ApiResponse(responseCode = "200", description = "Validation report",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = ValidationReport.class)))
    )
    public ValidationReport report() {
        return analyticsService.validationReport();
    }
}
