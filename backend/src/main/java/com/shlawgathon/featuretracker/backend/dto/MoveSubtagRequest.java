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
@Schema(description = "Request to move a subtag under another primary tag")
public class MoveSubtagRequest {

    @NotBlank
    @Schema(description = "Subtag to move", example = "Agent Mode")
    private String subtag;

    @NotBlank
    @Schema(description = "New owning primary tag", example = "AI Model")
    private String targetPrimary;
}
