package com.shlawgathon.featuretracker.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored changelog of one tracked product: metadata plus the ordered feature list.
 * The whole document is rewritten on every change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "products")
public class ProductDataset {

    // Product name doubles as the document id
    @Id
    private String name;

    private String url;

    @Builder.Default
    private boolean self = false;

    @Builder.Default
    private List<Feature> features = new ArrayList<>();

    @LastModifiedDate
    private Instant updatedAt;
}
