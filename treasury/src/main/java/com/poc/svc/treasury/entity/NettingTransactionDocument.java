package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 軋差交易的稽核副本；狀態只能經由結算確認改變。
 */
@Document(collection = "netting_results")
public record NettingTransactionDocument(
        @Id String id,
        @Field("transaction_id") String transactionId,
        @Field("netting_date") LocalDate nettingDate,
        @Field("from_entity") String fromEntity,
        @Field("to_entity") String toEntity,
        BigDecimal amount,
        String currency,
        String status,
        String scope,
        @Field("created_at") Instant createdAt,
        @Field("confirmed_at") Instant confirmedAt,
        @Field("trace_id") String traceId
) {

    public NettingTransactionDocument withStatus(String newStatus, Instant confirmedAt) {
        return new NettingTransactionDocument(id, transactionId, nettingDate, fromEntity, toEntity, amount,
                currency, newStatus, scope, createdAt, confirmedAt, traceId);
    }
}
