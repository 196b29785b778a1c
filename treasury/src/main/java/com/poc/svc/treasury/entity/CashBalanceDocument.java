package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * 匯入層寫入的原始餘額。balance_local 可能是數字或字串，於快照組裝時才解析。
 */
@Document(collection = "cash_balances")
public record CashBalanceDocument(
        @Id String id,
        @Field("account_number") String accountNumber,
        @Field("balance_date") String balanceDate,
        String currency,
        @Field("balance_local") Object balanceLocal,
        @Field("entity_code") String entityCode,
        String region
) {
}
