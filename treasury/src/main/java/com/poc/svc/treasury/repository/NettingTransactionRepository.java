package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.NettingTransactionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface NettingTransactionRepository extends MongoRepository<NettingTransactionDocument, String> {

    Optional<NettingTransactionDocument> findByTransactionId(String transactionId);

    List<NettingTransactionDocument> findByNettingDateOrderByTransactionIdAsc(LocalDate nettingDate);

    Optional<NettingTransactionDocument> findTopByOrderByNettingDateDesc();

    boolean existsByNettingDateAndStatusNot(LocalDate nettingDate, String status);

    long deleteByNettingDate(LocalDate nettingDate);
}
