package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.ValidationLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ValidationLogRepository extends MongoRepository<ValidationLogDocument, String> {

    Optional<ValidationLogDocument> findByCheckTypeAndCheckDate(String checkType, LocalDate checkDate);

    List<ValidationLogDocument> findByStatus(String status);
}
