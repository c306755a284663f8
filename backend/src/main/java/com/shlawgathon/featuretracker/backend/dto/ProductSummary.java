package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Product with feature counts per classification status")
public class ProductSummary {

    private String name;
    private String url;
    private boolean self;
    private int featureCount;
    private int untagged;
    private int notApplicable;
    private int tagged;
    private String latestDate;
    private Instant updatedAt;
}
