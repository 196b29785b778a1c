package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.BankAccountDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface BankAccountRepository extends MongoRepository<BankAccountDocument, String> {
}
