package com.shlawgathon.featuretracker.backend.dto;

import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.TagStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Feature as shown in admin listings, addressed by product and position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Feature with its product and position")
public class FeatureView {

    private String product;

    @Schema(description = "Position in the product's feature list")
    private int featureIndex;

    private String title;
    private String description;
    private String time;
    private TagStatus tagStatus;
    private List<TagAssignment> tags;

    public static FeatureView of(String product, int featureIndex, Feature feature) {
        return FeatureView.builder()
                .product(product)
                .featureIndex(featureIndex)
                .title(feature.getTitle())
                .description(feature.getDescription())
                .time(feature.getTime())
                .tagStatus(feature.effectiveStatus())
                .tags(feature.tagsOrEmpty())
                .build();
    }
}
