package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagAssignmentsTest {

    @Test
    void shouldCoalesceDuplicatePrimariesAndDropEmptyAssignments() {
        List<TagAssignment> tags = List.of(
                TagAssignment.of("AI Model", "OpenAI"),
                TagAssignment.of("Integration"),
                TagAssignment.of("AI Model", "Claude", "OpenAI"));

        List<TagAssignment> coalesced = TagAssignments.coalesce(tags);

        assertEquals(List.of(TagAssignment.of("AI Model", "OpenAI", "Claude")), coalesced);
    }

    @Test
    void shouldMoveSubtagBetweenAssignments() {
        List<TagAssignment> tags = new ArrayList<>(List.of(TagAssignment.of("Others", "agent mode")));

        assertEquals(1, TagAssignments.removeSubtag(tags, "agent mode"));
        TagAssignments.addTo(tags, "AI Model", "agent mode");

        assertEquals(List.of(TagAssignment.of("AI Model", "agent mode")), TagAssignments.coalesce(tags));
    }
}
