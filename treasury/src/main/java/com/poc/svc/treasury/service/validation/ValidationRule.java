package com.poc.svc.treasury.service.validation;

import com.poc.svc.treasury.domain.CheckType;
import com.poc.svc.treasury.domain.ValidationIssue;

import java.util.Optional;

/**
 * 單一資料品質檢核。每條規則彼此獨立，找到問題時回傳一筆彙總 issue。
 */
public interface ValidationRule {

    CheckType checkType();

    Optional<ValidationIssue> evaluate(ValidationContext context);
}
