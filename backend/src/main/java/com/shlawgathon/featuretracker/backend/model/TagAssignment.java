package com.shlawgathon.featuretracker.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One primary tag assigned to a feature together with the subtags chosen under it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagAssignment {

    private String name;

    @Builder.Default
    private List<SubtagRef> subtags = new ArrayList<>();

    public static TagAssignment of(String primary, String... subtagNames) {
        List<SubtagRef> refs = new ArrayList<>();
        for (String subtag : subtagNames) {
            refs.add(SubtagRef.of(subtag));
        }
        return new TagAssignment(primary, refs);
    }

    @JsonIgnore
    public List<SubtagRef> subtagsOrEmpty() {
        if (subtags == null) {
            subtags = new ArrayList<>();
        }
        return subtags;
    }

    @JsonIgnore
    public boolean containsSubtag(String subtagName) {
        return subtagsOrEmpty().stream().anyMatch(s -> subtagName.equals(s.getName()));
    }

    /**
     * Appends the subtag unless an entry with the same name is already present.
     *
     * @return true if the subtag was added
     */
    public boolean addSubtagIfAbsent(String subtagName) {
        if (containsSubtag(subtagName)) {
            return false;
        }
        subtagsOrEmpty().add(SubtagRef.of(subtagName));
        return true;
    }

    public TagAssignment copy() {
        List<SubtagRef> refs = new ArrayList<>();
        for (SubtagRef ref : subtagsOrEmpty()) {
            refs.add(SubtagRef.of(ref.getName()));
        }
        return new TagAssignment(name, refs);
    }
}
