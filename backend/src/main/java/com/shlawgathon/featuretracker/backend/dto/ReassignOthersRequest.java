package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Moves one feature out of the catch-all primary into a real category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to re-tag a feature currently filed under the catch-all primary")
public class ReassignOthersRequest {

    @NotBlank
    private String product;

    @NotNull
    private Integer featureIndex;

    @NotBlank
    @Schema(description = "Target primary tag", example = "AI Model")
    private String primaryTag;

    @NotBlank
    @Schema(description = "Subtag under the target primary, registered when new", example = "OpenAI")
    private String subtag;
}
