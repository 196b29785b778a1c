package com.poc.svc.treasury.controller;

import com.poc.svc.treasury.domain.NettingResult;
import com.poc.svc.treasury.domain.NettingTransaction;
import com.poc.svc.treasury.domain.TransactionStatus;
import com.poc.svc.treasury.dto.ErrorResponse;
import com.poc.svc.treasury.dto.SettlementConfirmationRequest;
import com.poc.svc.treasury.service.TreasuryAnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/treasury/netting")
@Tag(name = "Netting", description = "法人間多邊軋差")
public class NettingController {

    private final TreasuryAnalyticsService analyticsService;

    public NettingController(TreasuryAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping("/run")
    @Operation(
            operationId = "runNetting",
            summary = "Compute netting transactions for a snapshot",
            description = "產生的交易一律為 Pending，並取代同一日期先前保存的稽核紀錄。",
            parameters = @Parameter(name = "asOf", in = ParameterIn.QUERY, required = false, description = "快照日期 (yyyy-MM-dd)"),
            responses = @ApiResponse(responseCode = "200", description = "Netting result",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = NettingResult.class)))
    )
    public NettingResult run(
            @RequestParam(name = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return analyticsService.runNetting(asOf);
    }

    @GetMapping("/results")
    @Operation(
            operationId = "getNettingResults",
            summary = "Persisted netting transactions",
            description = "未指定日期時回傳最近一次軋差。",
            parameters = @Parameter(name = "date", in = ParameterIn.QUERY, required = false, description = "軋差日期 (yyyy-MM-dd)"),
            responses = @ApiResponse(responseCode = "200", description = "Netting result",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = NettingResult.class)))
    )
    public NettingResult results(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return analyticsService.nettingResults(date);
    }

    @PostMapping("/transactions/{transactionId}/confirm")
    @Operation(
            operationId = "confirmSettlement",
            summary = "Record the external settlement outcome of a pending transaction",
            parameters = @Parameter(name = "transactionId", in = ParameterIn.PATH, required = true, description = "NET-yyyyMMdd-nnnn"),
            responses = {
                    @ApiResponse(responseCode = "200", description = "Updated transaction",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = NettingTransaction.class))),
                    @ApiResponse(responseCode = "404", description = "查無交易",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "409", description = "交易已非 Pending",
                            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public NettingTransaction confirm(@PathVariable String transactionId,
                                      @Valid @RequestBody SettlementConfirmationRequest request) {
        return analyticsService.confirmSettlement(transactionId, TransactionStatus.fromLabel(request.status()));
    }
}
