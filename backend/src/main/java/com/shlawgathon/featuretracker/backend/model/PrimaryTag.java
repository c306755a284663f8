package com.shlawgathon.featuretracker.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level taxonomy category with its subtags.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrimaryTag {

    private String name;
    private String description;

    @Builder.Default
    private List<Subtag> subtags = new ArrayList<>();

    @JsonIgnore
    public List<Subtag> subtagsOrEmpty() {
        if (subtags == null) {
            subtags = new ArrayList<>();
        }
        return subtags;
    }
}
