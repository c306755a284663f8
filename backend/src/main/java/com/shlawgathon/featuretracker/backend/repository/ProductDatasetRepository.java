package com.shlawgathon.featuretracker.backend.repository;

import com.shlawgathon.featuretracker.backend.model.ProductDataset;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProductDatasetRepository extends MongoRepository<ProductDataset, String> {

    List<ProductDataset> findAllByOrderByNameAsc();

    Optional<ProductDataset> findFirstBySelfTrue();
}
