package com.shlawgathon.featuretracker.backend.merge;

import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.TagStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles a fresh scrape of one product with its stored features.
 * <p>
 * The scrape is authoritative for membership and content: the result holds exactly the scraped entries in
 * scrape order. Stored classifications are carried over by {@link FeatureKey} when they hold a non-empty tag
 * list; every other entry comes out pending.
 */
@Component
public class FeatureMergeEngine {

    /**
     * Builds the lookup of stored features. A later entry with the same key replaces an earlier one.
     */
    public static Map<FeatureKey, Feature> indexByKey(List<Feature> features) {
        Map<FeatureKey, Feature> index = new LinkedHashMap<>();
        if (features == null) {
            return index;
        }
        for (Feature feature : features) {
            index.put(FeatureKey.of(feature), feature);
        }
        return index;
    }

    /**
     * Merges {@code freshList} against {@code oldIndex}.
     *
     * @throws IllegalArgumentException if {@code freshList} is empty; an empty scrape is a failed crawl
     */
    public MergeResult merge(Map<FeatureKey, Feature> oldIndex, List<Feature> freshList) {
        if (freshList == null || freshList.isEmpty()) {
            throw new IllegalArgumentException("Refusing to merge an empty scrape result");
        }

        List<Feature> merged = new ArrayList<>(freshList.size());
        Set<FeatureKey> newKeys = new LinkedHashSet<>();
        Set<FeatureKey> seen = new HashSet<>();

        for (Feature fresh : freshList) {
            FeatureKey key = FeatureKey.of(fresh);
            if (!seen.add(key)) {
                continue;
            }

            Feature old = oldIndex.get(key);
            if (old != null && old.hasConfidentTags()) {
                fresh.setTagStatus(TagStatus.TAGGED);
                fresh.setTags(copyOf(old.getTags()));
            } else {
                if (fresh.getTagStatus() == null) {
                    fresh.setTagStatus(TagStatus.UNTAGGED);
                }
                newKeys.add(key);
            }
            merged.add(fresh);
        }

        return new MergeResult(merged, newKeys);
    }

    private static List<TagAssignment> copyOf(List<TagAssignment> tags) {
        List<TagAssignment> copy = new ArrayList<>(tags.size());
        for (TagAssignment tag : tags) {
            copy.add(tag.copy());
        }
        return copy;
    }
}
