package com.shlawgathon.featuretracker.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One changelog entry of a tracked product, embedded in its {@link ProductDataset}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Feature {

    private String title;
    private String description;

    // YYYY-MM-DD, "Month YYYY" or empty
    private String time;

    @Builder.Default
    private TagStatus tagStatus = TagStatus.UNTAGGED;

    @Builder.Default
    private List<TagAssignment> tags = new ArrayList<>();

    @JsonIgnore
    public TagStatus effectiveStatus() {
        return tagStatus != null ? tagStatus : TagStatus.UNTAGGED;
    }

    @JsonIgnore
    public boolean isPending() {
        return effectiveStatus() == TagStatus.UNTAGGED;
    }

    @JsonIgnore
    public List<TagAssignment> tagsOrEmpty() {
        if (tags == null) {
            tags = new ArrayList<>();
        }
        return tags;
    }

    /**
     * True when the feature carries a non-empty, confidently assigned tag list.
     */
    @JsonIgnore
    public boolean hasConfidentTags() {
        return effectiveStatus() == TagStatus.TAGGED && tags != null && !tags.isEmpty();
    }

    public void markTagged(List<TagAssignment> assignments) {
        this.tagStatus = TagStatus.TAGGED;
        this.tags = new ArrayList<>(assignments);
    }

    public void markNotApplicable() {
        this.tagStatus = TagStatus.NOT_APPLICABLE;
        this.tags = new ArrayList<>();
    }

    public void resetToPending() {
        this.tagStatus = TagStatus.UNTAGGED;
        this.tags = new ArrayList<>();
    }
}
