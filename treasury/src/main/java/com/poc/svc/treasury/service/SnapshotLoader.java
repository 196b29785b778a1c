package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.TreasurySnapshot;

import java.time.LocalDate;
import java.util.SortedSet;

/**
 * 取得單一日期的完整輸入快照。
 */
public interface SnapshotLoader {

    /**
     * @param asOfDate 快照日期；{@code null} 代表最新一筆餘額的日期
     * @throws com.poc.svc.treasury.exception.SnapshotEmptyException 該日期沒有帳戶或餘額
     */
    TreasurySnapshot load(LocalDate asOfDate);

    SortedSet<LocalDate> availableDates(LocalDate from, LocalDate to);
}
