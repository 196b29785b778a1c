package com.poc.svc.treasury.domain;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 單一 as-of 日期的輸入資料快照，計算期間視為不可變。
 * balances 只包含 as-of 當日的資料；fxRates 保留所有日期，由換算時挑選。
 */
public record TreasurySnapshot(
        LocalDate asOfDate,
        List<BankAccount> accounts,
        List<CashBalance> balances,
        List<FxRate> fxRates,
        List<LegalEntity> entities,
        List<CashPool> pools,
        List<RejectedRecord> rejectedRecords
) {
    public TreasurySnapshot {
        Objects.requireNonNull(asOfDate, "asOfDate must not be null");
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        balances = balances == null ? List.of() : List.copyOf(balances);
        fxRates = fxRates == null ? List.of() : List.copyOf(fxRates);
        entities = entities == null ? List.of() : List.copyOf(entities);
        pools = pools == null ? List.of() : List.copyOf(pools);
        rejectedRecords = rejectedRecords == null ? List.of() : List.copyOf(rejectedRecords);
    }

    public Map<String, BankAccount> accountsById() {
        Map<String, BankAccount> byId = new LinkedHashMap<>();
        for (BankAccount account : accounts) {
            byId.putIfAbsent(account.accountId(), account);
        }
        return byId;
    }

    public Map<String, LegalEntity> entitiesByCode() {
        Map<String, LegalEntity> byCode = new LinkedHashMap<>();
        for (LegalEntity entity : entities) {
            byCode.putIfAbsent(entity.entityCode(), entity);
        }
        return byCode;
    }

    public List<CashPool> activePools() {
        return pools.stream().filter(CashPool::active).toList();
    }

    public boolean isEmpty() {
        return accounts.isEmpty() || balances.isEmpty();
    }
}
