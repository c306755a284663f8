package com.shlawgathon.featuretracker.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last monitor run per product.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "sync_status")
public class SyncStatus {

    @Id
    private String productName;

    private Instant lastSync;
    private String latestDate;
    private MonitorOutcome lastOutcome;
}
