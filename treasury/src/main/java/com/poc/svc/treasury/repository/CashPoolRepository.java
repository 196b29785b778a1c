package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.CashPoolDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CashPoolRepository extends MongoRepository<CashPoolDocument, String> {
}
