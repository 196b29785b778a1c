package com.poc.svc.treasury.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "treasury.validation")
public class ValidationProperties {

    /**
     * 允許負餘額的帳戶類型（不分大小寫）。
     */
    private List<String> creditAccountTypes = new ArrayList<>(List.of("Overdraft", "Credit Facility"));

    public List<String> getCreditAccountTypes() {
        return creditAccountTypes;
    }

    public void setCreditAccountTypes(List<String> creditAccountTypes) {
        this.creditAccountTypes = creditAccountTypes == null ? new ArrayList<>() : creditAccountTypes;
    }
}
