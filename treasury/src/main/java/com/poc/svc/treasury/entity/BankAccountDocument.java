package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "bank_accounts")
public record BankAccountDocument(
        @Id String id,
        @Field("account_number") String accountNumber,
        @Field("account_name") String accountName,
        @Field("entity_code") String entityCode,
        @Field("bank_name") String bankName,
        String currency,
        @Field("country_code") String countryCode,
        String region,
        @Field("account_type") String accountType,
        Boolean active
) {
}
