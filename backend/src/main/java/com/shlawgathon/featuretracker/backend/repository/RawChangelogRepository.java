package com.shlawgathon.featuretracker.backend.repository;

import com.shlawgathon.featuretracker.backend.model.RawChangelog;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RawChangelogRepository extends MongoRepository<RawChangelog, String> {
}
