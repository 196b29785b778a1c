package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "fx_rates")
public record FxRateDocument(
        @Id String id,
        @Field("currency_pair") String currencyPair,
        Object rate,
        @Field("rate_date") String rateDate
) {
}
