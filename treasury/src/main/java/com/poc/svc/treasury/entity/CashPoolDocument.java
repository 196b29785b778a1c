package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

@Document(collection = "cash_pools")
public record CashPoolDocument(
        @Id String id,
        @Field("pool_name") String poolName,
        @Field("pool_type") String poolType,
        String region,
        @Field("header_account") String headerAccount,
        @Field("participant_accounts") List<String> participantAccounts,
        String currency,
        Boolean active
) {
}
