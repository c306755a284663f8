package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to add a feature by hand")
public class AddFeatureRequest {

    @NotBlank
    @Schema(description = "Product name", example = "youware")
    private String product;

    @NotBlank
    @Schema(description = "Feature title", example = "Figma import")
    private String title;

    private String description;

    @Schema(description = "Release date, today when empty", example = "2026-01-12")
    private String time;

    @Schema(description = "Classify the feature right away")
    private boolean autoTag;
}
