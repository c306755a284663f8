package com.shlawgathon.featuretracker.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Markdown changelog of the self product")
public class ChangelogRequest {

    @Schema(description = "Changelog markdown")
    private String content;
}
