package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.TagKind;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rename a tag; renaming onto an existing tag of the same kind merges the two.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to rename or merge a tag")
public class RenameTagRequest {

    @NotBlank
    @Schema(description = "Current tag name", example = "Open AI")
    private String oldName;

    @NotBlank
    @Schema(description = "New tag name, or an existing tag to merge into", example = "OpenAI")
    private String newName;

    @NotNull
    @Schema(description = "Which namespace the tag lives in", example = "subtag")
    private TagKind type;
}
