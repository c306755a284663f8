package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.model.SubtagRef;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for a feature's list of tag assignments.
 */
public final class TagAssignments {

    private TagAssignments() {
    }

    /**
     * Folds assignments with the same primary into the first one, removes duplicate subtags and drops
     * assignments left without subtags. Order of first appearance is kept.
     */
    public static List<TagAssignment> coalesce(List<TagAssignment> assignments) {
        Map<String, TagAssignment> byPrimary = new LinkedHashMap<>();
        if (assignments == null) {
            return new ArrayList<>();
        }
        for (TagAssignment assignment : assignments) {
            if (assignment == null || assignment.getName() == null) {
                continue;
            }
            TagAssignment target = byPrimary.computeIfAbsent(assignment.getName(),
                    name -> new TagAssignment(name, new ArrayList<>()));
            for (SubtagRef ref : assignment.subtagsOrEmpty()) {
                if (ref != null && ref.getName() != null) {
                    target.addSubtagIfAbsent(ref.getName());
                }
            }
        }
        List<TagAssignment> result = new ArrayList<>();
        for (TagAssignment assignment : byPrimary.values()) {
            if (!assignment.subtagsOrEmpty().isEmpty()) {
                result.add(assignment);
            }
        }
        return result;
    }

    /**
     * Adds {@code subtag} to the assignment of {@code primary}, creating the assignment when missing.
     */
    public static void addTo(List<TagAssignment> assignments, String primary, String subtag) {
        for (TagAssignment assignment : assignments) {
            if (primary.equals(assignment.getName())) {
                assignment.addSubtagIfAbsent(subtag);
                return;
            }
        }
        assignments.add(TagAssignment.of(primary, subtag));
    }

    /**
     * Removes every reference to {@code subtag}.
     *
     * @return number of assignments that held it
     */
    public static int removeSubtag(List<TagAssignment> assignments, String subtag) {
        int touched = 0;
        for (TagAssignment assignment : assignments) {
            if (assignment.subtagsOrEmpty().removeIf(ref -> subtag.equals(ref.getName()))) {
                touched++;
            }
        }
        return touched;
    }
}
