package com.shlawgathon.featuretracker.backend.repository;

import com.shlawgathon.featuretracker.backend.model.SyncStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncStatusRepository extends MongoRepository<SyncStatus, String> {
}
