package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "entities")
public record LegalEntityDocument(
        @Id String id,
        @Field("entity_code") String entityCode,
        @Field("entity_name") String entityName,
        @Field("country_code") String countryCode,
        String region
) {
}
