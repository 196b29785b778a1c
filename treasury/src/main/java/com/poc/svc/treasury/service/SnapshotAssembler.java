package com.poc.svc.treasury.service;

import com.poc.svc.treasury.domain.BankAccount;
import com.poc.svc.treasury.domain.CashBalance;
import com.poc.svc.treasury.domain.CashPool;
import com.poc.svc.treasury.domain.FxRate;
import com.poc.svc.treasury.domain.LegalEntity;
import com.poc.svc.treasury.domain.PoolType;
import com.poc.svc.treasury.domain.RecordType;
import com.poc.svc.treasury.domain.RejectedRecord;
import com.poc.svc.treasury.domain.TreasurySnapshot;
import com.poc.svc.treasury.entity.BankAccountDocument;
import com.poc.svc.treasury.entity.CashBalanceDocument;
import com.poc.svc.treasury.entity.CashPoolDocument;
import com.poc.svc.treasury.entity.FxRateDocument;
import com.poc.svc.treasury.entity.LegalEntityDocument;
import com.poc.svc.treasury.exception.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 將 MongoDB 原始文件轉為型別化快照。格式錯誤的紀錄會被排除並記錄為 {@link RejectedRecord}，
 * 不會被當成零值繼續計算。
 */
@Component
public class SnapshotAssembler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAssembler.class);
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");
    static final String UNKNOWN_REGION = "UNKNOWN";

    public record RawSnapshot(
            List<BankAccountDocument> accounts,
            List<CashBalanceDocument> balances,
            List<FxRateDocument> fxRates,
            List<LegalEntityDocument> entities,
            List<CashPoolDocument> pools
    ) {
        public RawSnapshot {
            accounts = accounts == null ? List.of() : accounts;
            balances = balances == null ? List.of() : balances;
            fxRates = fxRates == null ? List.of() : fxRates;
            entities = entities == null ? List.of() : entities;
            pools = pools == null ? List.of() : pools;
        }
    }

    public TreasurySnapshot assemble(LocalDate asOfDate, RawSnapshot raw) {
        Objects.requireNonNull(asOfDate, "asOfDate must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
        List<RejectedRecord> rejected = new ArrayList<>();

        Map<String, LegalEntity> entities = new HashMap<>();
        List<LegalEntity> entityList = new ArrayList<>();
        for (LegalEntityDocument document : raw.entities()) {
            try {
                LegalEntity entity = toEntity(document);
                if (entities.putIfAbsent(entity.entityCode(), entity) == null) {
                    entityList.add(entity);
                } else {
                    throw new MalformedRecordException(RecordType.ENTITY, entity.entityCode(), "Duplicate entity code");
                }
            } catch (MalformedRecordException ex) {
                reject(rejected, ex);
            }
        }

        Map<String, BankAccount> accounts = new HashMap<>();
        List<BankAccount> accountList = new ArrayList<>();
        for (BankAccountDocument document : raw.accounts()) {
            try {
                BankAccount account = toAccount(document, entities);
                if (accounts.putIfAbsent(account.accountId(), account) == null) {
                    accountList.add(account);
                } else {
                    throw new MalformedRecordException(RecordType.ACCOUNT, account.accountId(), "Duplicate account number");
                }
            } catch (MalformedRecordException ex) {
                reject(rejected, ex);
            }
        }

        List<CashBalance> balances = new ArrayList<>();
        for (CashBalanceDocument document : raw.balances()) {
            try {
                CashBalance balance = toBalance(document, accounts);
                if (balance.balanceDate().equals(asOfDate)) {
                    balances.add(balance);
                }
            } catch (MalformedRecordException ex) {
                reject(rejected, ex);
            }
        }

        List<FxRate> rates = new ArrayList<>();
        for (FxRateDocument document : raw.fxRates()) {
            try {
                rates.add(toRate(document));
            } catch (MalformedRecordException ex) {
                reject(rejected, ex);
            }
        }

        List<CashPool> pools = new ArrayList<>();
        for (CashPoolDocument document : raw.pools()) {
            try {
                pools.add(toPool(document));
            } catch (MalformedRecordException ex) {
                reject(rejected, ex);
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("asOf={} rejectedRecords={}", asOfDate, rejected.size());
        }
        return new TreasurySnapshot(asOfDate, accountList, balances, rates, entityList, pools, rejected);
    }

    LegalEntity toEntity(LegalEntityDocument document) {
        String code = required(RecordType.ENTITY, document.entityCode(), document.entityCode(), "entity_code");
        return new LegalEntity(
                code,
                document.entityName(),
                document.countryCode(),
                StringUtils.hasText(document.region()) ? document.region().trim().toUpperCase(Locale.ROOT) : null
        );
    }

    BankAccount toAccount(BankAccountDocument document, Map<String, LegalEntity> entities) {
        String reference = document.accountNumber();
        String accountId = required(RecordType.ACCOUNT, reference, document.accountNumber(), "account_number");
        String entityCode = required(RecordType.ACCOUNT, reference, document.entityCode(), "entity_code");
        String currency = currency(RecordType.ACCOUNT, reference, document.currency());

        String region = document.region();
        if (!StringUtils.hasText(region)) {
            LegalEntity entity = entities.get(entityCode);
            region = entity == null ? null : entity.region();
        }
        region = StringUtils.hasText(region) ? region.trim().toUpperCase(Locale.ROOT) : UNKNOWN_REGION;

        return new BankAccount(
                accountId,
                entityCode,
                currency,
                region,
                document.accountType(),
                document.active() == null || document.active()
        );
    }

    CashBalance toBalance(CashBalanceDocument document, Map<String, BankAccount> accounts) {
        String reference = document.accountNumber() + "@" + document.balanceDate();
        String accountId = required(RecordType.BALANCE, reference, document.accountNumber(), "account_number");
        if (!accounts.containsKey(accountId)) {
            throw new MalformedRecordException(RecordType.BALANCE, reference, "Balance references unknown account " + accountId);
        }
        return new CashBalance(
                accountId,
                date(RecordType.BALANCE, reference, document.balanceDate()),
                currency(RecordType.BALANCE, reference, document.currency()),
                decimal(RecordType.BALANCE, reference, document.balanceLocal(), "balance_local")
        );
    }

    FxRate toRate(FxRateDocument document) {
        String reference = document.currencyPair() + "@" + document.rateDate();
        String pair = required(RecordType.FX_RATE, reference, document.currencyPair(), "currency_pair");
        String[] parts = pair.split("/");
        if (parts.length != 2) {
            throw new MalformedRecordException(RecordType.FX_RATE, reference, "Malformed currency pair " + pair);
        }
        BigDecimal rate = decimal(RecordType.FX_RATE, reference, document.rate(), "rate");
        if (rate.signum() <= 0) {
            throw new MalformedRecordException(RecordType.FX_RATE, reference, "Rate must be positive but was " + rate.toPlainString());
        }
        return new FxRate(
                currency(RecordType.FX_RATE, reference, parts[0]),
                currency(RecordType.FX_RATE, reference, parts[1]),
                rate,
                date(RecordType.FX_RATE, reference, document.rateDate())
        );
    }

    CashPool toPool(CashPoolDocument document) {
        String name = required(RecordType.POOL, document.poolName(), document.poolName(), "pool_name");
        PoolType type;
        try {
            type = PoolType.fromLabel(document.poolType());
        } catch (IllegalArgumentException ex) {
            throw new MalformedRecordException(RecordType.POOL, name, ex.getMessage(), ex);
        }
        List<String> participants = document.participantAccounts() == null
                ? List.of()
                : document.participantAccounts().stream()
                        .filter(StringUtils::hasText)
                        .map(String::trim)
                        .distinct()
                        .toList();
        return new CashPool(
                name,
                type,
                StringUtils.hasText(document.region()) ? document.region().trim().toUpperCase(Locale.ROOT) : UNKNOWN_REGION,
                participants,
                document.active() == null || document.active()
        );
    }

    private static String required(RecordType type, String reference, String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new MalformedRecordException(type, reference, "Missing " + field);
        }
        return value.trim();
    }

    private static String currency(RecordType type, String reference, String value) {
        String code = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_CODE.matcher(code).matches()) {
            throw new MalformedRecordException(type, reference, "Unknown currency code '" + value + "'");
        }
        return code;
    }

    private static LocalDate date(RecordType type, String reference, String value) {
        if (!StringUtils.hasText(value)) {
            throw new MalformedRecordException(type, reference, "Missing date");
        }
        String trimmed = value.trim();
        // ISO timestamps carry the date in their first ten characters
        String datePart = trimmed.length() > 10 && trimmed.charAt(10) == 'T' ? trimmed.substring(0, 10) : trimmed;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException ex) {
            throw new MalformedRecordException(type, reference, "Unparseable date '" + value + "'", ex);
        }
    }

    private static BigDecimal decimal(RecordType type, String reference, Object value, String field) {
        if (value == null) {
            throw new MalformedRecordException(type, reference, "Missing " + field);
        }
        if (!(value instanceof Number) && !(value instanceof CharSequence)) {
            throw new MalformedRecordException(type, reference, "Non-numeric " + field + " '" + value + "'");
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new MalformedRecordException(type, reference, "Non-numeric " + field + " '" + value + "'", ex);
        }
    }

    private static void reject(List<RejectedRecord> rejected, MalformedRecordException ex) {
        log.debug("Rejected {} record reference={} reason={}", ex.recordType(), ex.reference(), ex.getMessage());
        rejected.add(new RejectedRecord(ex.recordType(), ex.reference(), ex.getMessage()));
    }
}
