package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.CashBalanceDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;
import java.util.Optional;

public interface CashBalanceRepository extends MongoRepository<CashBalanceDocument, String> {

    List<CashBalanceDocument> findByBalanceDate(String balanceDate);

    Optional<CashBalanceDocument> findTopByOrderByBalanceDateDesc();

    @Query(value = "{ 'balance_date': { $gte: ?0, $lte: ?1 } }", fields = "{ 'balance_date': 1 }")
    List<CashBalanceDocument> findBalanceDatesBetween(String from, String to);
}
