package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.LegalEntityDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface LegalEntityRepository extends MongoRepository<LegalEntityDocument, String> {
}
