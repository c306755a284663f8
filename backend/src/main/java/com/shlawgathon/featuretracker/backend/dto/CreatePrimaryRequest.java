package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to add a primary tag")
public class CreatePrimaryRequest {

    @NotBlank
    @Schema(description = "Primary tag name", example = "Deployment")
    private String name;

    @Schema(description = "What the category covers")
    private String description;

    @Builder.Default
    @Schema(description = "Subtags to register under the new primary")
    private List<String> subtags = new ArrayList<>();
}
