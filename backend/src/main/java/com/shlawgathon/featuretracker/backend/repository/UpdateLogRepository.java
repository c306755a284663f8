package com.shlawgathon.featuretracker.backend.repository;

import com.shlawgathon.featuretracker.backend.model.UpdateLog;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UpdateLogRepository extends MongoRepository<UpdateLog, String> {

    List<UpdateLog> findTop20ByOrderByTimestampDesc();
}
