package com.poc.svc.treasury.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "treasury.pooling")
public class PoolingProperties {

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false, message = "treasury.pooling.efficiency-epsilon must be > 0")
    private BigDecimal efficiencyEpsilon = new BigDecimal("0.000001");

    public BigDecimal getEfficiencyEpsilon() {
        return efficiencyEpsilon;
    }

    public void setEfficiencyEpsilon(BigDecimal efficiencyEpsilon) {
        this.efficiencyEpsilon = efficiencyEpsilon;
    }
}
