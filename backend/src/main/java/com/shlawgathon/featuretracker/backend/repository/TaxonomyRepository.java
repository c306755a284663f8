package com.shlawgathon.featuretracker.backend.repository;

import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TaxonomyRepository extends MongoRepository<Taxonomy, String> {
}
