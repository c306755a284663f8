package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a feature's content. Null fields are left as they are.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to edit a feature")
public class EditFeatureRequest {

    @NotBlank
    private String product;

    @NotNull
    private Integer featureIndex;

    private String title;
    private String description;
    private String time;
}
