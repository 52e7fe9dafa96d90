package com.motaz.fraudscan.repositories;

import com.motaz.fraudscan.model.documents.AlertPreferenceDocument;
import com.redis.om.spring.repository.RedisDocumentRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertPreferenceDocumentRepository extends RedisDocumentRepository<AlertPreferenceDocument, String> {
    Optional<AlertPreferenceDocument> findByUserId(String userId);
}
