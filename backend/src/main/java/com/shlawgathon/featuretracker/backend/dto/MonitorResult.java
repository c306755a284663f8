package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.MonitorOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of monitoring one product: crawl, merge and tagging of the new entries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-product monitor result")
public class MonitorResult {

    @Schema(description = "Product name", example = "lovable")
    private String productName;

    @Schema(description = "Outcome of the run")
    private MonitorOutcome outcome;

    @Schema(description = "Number of features after the merge")
    private int totalFeatures;

    @Schema(description = "Number of features that need classification")
    private int newCount;

    @Builder.Default
    @Schema(description = "Titles of the new features")
    private List<String> newTitles = new ArrayList<>();

    @Schema(description = "Tagging counters for the new features")
    private TaggingReport tagging;

    @Schema(description = "Failure reason when the crawl did not succeed")
    private String message;
}
