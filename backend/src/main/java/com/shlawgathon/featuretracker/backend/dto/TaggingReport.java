package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of one tagging batch over a product.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Tagging batch counters")
public class TaggingReport {

    private String productName;

    @Schema(description = "Features sent to the classification oracle")
    private int processed;

    @Schema(description = "Features stored with tags")
    private int classified;

    @Schema(description = "Features the oracle found not applicable")
    private int skipped;

    @Schema(description = "Features left pending after an oracle failure")
    private int pending;

    @Builder.Default
    @Schema(description = "Subtags added to the taxonomy by this batch")
    private List<String> newSubtags = new ArrayList<>();

    @Schema(description = "Set when the product could not be processed")
    private String error;
}
