package com.shlawgathon.featuretracker.backend.merge;

import com.shlawgathon.featuretracker.backend.model.Feature;

import java.util.List;
import java.util.Set;

/**
 * Output of {@link FeatureMergeEngine#merge}.
 *
 * @param merged  the new feature list in scrape order
 * @param newKeys identities that need classification in this run
 */
public record MergeResult(List<Feature> merged, Set<FeatureKey> newKeys) {

    public List<Feature> newFeatures() {
        return merged.stream().filter(f -> newKeys.contains(FeatureKey.of(f))).toList();
    }
}
