package com.poc.svc.treasury.domain;

import java.math.BigDecimal;

public record EntityBalance(String entity, BigDecimal balance) {
}
