package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.TagStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paged feature search")
public class FeatureSearchRequest {

    @Schema(description = "Restrict to one product; all products when empty", example = "lovable")
    private String product;

    @Schema(description = "Case-insensitive text matched against title and description")
    private String search;

    @Schema(description = "Primary tag or subtag name")
    private String tag;

    @Schema(description = "Classification status filter")
    private TagStatus status;

    @Builder.Default
    @Schema(description = "1-based page number", example = "1")
    private int page = 1;

    @Builder.Default
    @Schema(description = "Page size", example = "20")
    private int pageSize = 20;
}
