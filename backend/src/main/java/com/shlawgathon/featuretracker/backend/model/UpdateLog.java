package com.shlawgathon.featuretracker.backend.model;

import com.shlawgathon.featuretracker.backend.dto.MonitorResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record of a monitor run that discovered new features.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "update_logs")
public class UpdateLog {

    @Id
    private String id;

    @Indexed
    private Instant timestamp;

    private int totalNew;

    @Builder.Default
    private Map<String, MonitorResult> updates = new LinkedHashMap<>();
}
