package com.poc.svc.treasury.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "SettlementConfirmationRequest", description = "外部結算結果")
public record SettlementConfirmationRequest(
        @Schema(description = "結算結果", allowableValues = {"Settled", "Failed"}, example = "Settled")
        @NotBlank String status
) {
}
