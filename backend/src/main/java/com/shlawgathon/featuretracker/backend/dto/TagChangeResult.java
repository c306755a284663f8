package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.TagKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a taxonomy admin change and how far it propagated into product data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a rename, merge or move")
public class TagChangeResult {

    public enum Mode {
        RENAMED,
        MERGED,
        MOVED,
        UNCHANGED
    }

    private Mode mode;
    private TagKind kind;
    private String oldName;
    private String newName;

    @Schema(description = "Product documents rewritten")
    private int affectedProductCount;

    @Schema(description = "Tag assignments touched across all features")
    private int affectedAssignmentCount;
}
