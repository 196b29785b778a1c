package com.poc.svc.treasury.config;

import com.poc.svc.treasury.domain.NettingTarget;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "treasury.netting")
public class NettingProperties {

    @NotNull
    @DecimalMin(value = "0.0", message = "treasury.netting.epsilon must be >= 0")
    private BigDecimal epsilon = new BigDecimal("0.01");

    @NotNull
    private NettingTarget target = NettingTarget.ZERO;

    /**
     * 參與實體資金池的帳戶已由資金池歸零，預設不再納入法人間軋差。
     */
    private boolean excludePooledAccounts = true;

    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(BigDecimal epsilon) {
        this.epsilon = epsilon;
    }

    public NettingTarget getTarget() {
        return target;
    }

    public void setTarget(NettingTarget target) {
        this.target = target;
    }

    public boolean isExcludePooledAccounts() {
        return excludePooledAccounts;
    }

    public void setExcludePooledAccounts(boolean excludePooledAccounts) {
        this.excludePooledAccounts = excludePooledAccounts;
    }
}
