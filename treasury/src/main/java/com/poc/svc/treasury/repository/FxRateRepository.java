package com.poc.svc.treasury.repository;

import com.poc.svc.treasury.entity.FxRateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface FxRateRepository extends MongoRepository<FxRateDocument, String> {
}
