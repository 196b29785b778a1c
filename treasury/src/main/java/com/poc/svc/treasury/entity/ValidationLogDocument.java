package com.poc.svc.treasury.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 每個 check type 與檢核日期至多一筆紀錄；重新檢核同一日期時原地更新或改為 Resolved。
 */
@Document(collection = "validation_logs")
public record ValidationLogDocument(
        @Id String id,
        @Field("check_type") String checkType,
        String severity,
        String description,
        @Field("affected_records") int affectedRecords,
        @Field("check_date") LocalDate checkDate,
        String status,
        @Field("first_detected_at") Instant firstDetectedAt,
        @Field("updated_at") Instant updatedAt
) {
}
