package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Replace a feature's tags. An empty list puts the feature back in the tagging queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to set the tags of a feature")
public class UpdateTagsRequest {

    @NotBlank
    private String product;

    @NotNull
    private Integer featureIndex;

    @Builder.Default
    private List<TagAssignment> tags = new ArrayList<>();
}
