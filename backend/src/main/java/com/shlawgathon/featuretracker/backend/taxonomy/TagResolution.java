package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.model.TagAssignment;

import java.util.List;

/**
 * Result of resolving oracle proposals against the taxonomy.
 *
 * @param assignments      validated assignments grouped by primary tag
 * @param droppedAsInvalid proposals rejected because they named a primary tag or were blank
 * @param newlyCreated     subtags registered in the taxonomy by this resolution
 */
public record TagResolution(
        List<TagAssignment> assignments,
        List<String> droppedAsInvalid,
        List<String> newlyCreated
) {

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public boolean grewTaxonomy() {
        return !newlyCreated.isEmpty();
    }
}
