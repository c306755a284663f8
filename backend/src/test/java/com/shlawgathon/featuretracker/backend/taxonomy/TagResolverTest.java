package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.Subtag;
import com.shlawgathon.featuretracker.backend.model.TagAssignment;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagResolverTest {

    private TaxonomyIndex index;
    private TagResolver resolver;

    @BeforeEach
    void setUp() {
        index = new TaxonomyIndex(TaxonomyIndexTest.sampleTaxonomy());
        resolver = new TagResolver(index);
    }

    @Test
    void shouldResolveKnownNameAndFileNovelNameUnderOthers() {
        // Given
        Taxonomy taxonomy = Taxonomy.empty();
        taxonomy.getPrimaryTags().add(PrimaryTag.builder()
                .name("AI Model")
                .subtags(new ArrayList<>(List.of(new Subtag("OpenAI", "OpenAI"))))
                .build());
        taxonomy.getSubtagToPrimary().put("OpenAI", "AI Model");
        TagResolver onlyModels = new TagResolver(new TaxonomyIndex(taxonomy));

        // When
        TagResolution resolution = onlyModels.resolve(List.of("Open AI", "agent mode"), null);

        // Then
        assertEquals(List.of(
                TagAssignment.of("AI Model", "OpenAI"),
                TagAssignment.of("Others", "agent mode")), resolution.assignments());
        assertEquals(List.of("agent mode"), resolution.newlyCreated());
        assertEquals("Others", taxonomy.getSubtagToPrimary().get("agent mode"));
        assertEquals("Uncategorized subtags awaiting review",
                taxonomy.getPrimaryTags().get(1).getDescription());
    }

    @Test
    void shouldDropPrimaryNamesAndBlanks() {
        TagResolution resolution = resolver.resolve(Arrays.asList("ai model", " ", null, "Claude"), null);

        assertEquals(List.of(TagAssignment.of("AI Model", "Claude")), resolution.assignments());
        assertEquals(3, resolution.droppedAsInvalid().size());
        assertFalse(resolution.grewTaxonomy());
    }

    @Test
    void shouldRegisterNovelNameUnderHintedPrimary() {
        TagResolution resolution = resolver.resolve(List.of("Gemini"), "ai-model");

        assertEquals(List.of(TagAssignment.of("AI Model", "Gemini")), resolution.assignments());
        assertEquals("AI Model", index.ownerOf("Gemini").orElseThrow());
    }

    @Test
    void shouldFallBackToOthersForUnknownHint() {
        TagResolution resolution = resolver.resolve(List.of("Voice Input"), "Accessibility");

        assertEquals(List.of(TagAssignment.of("Others", "Voice Input")), resolution.assignments());
        assertFalse(index.hasPrimary("Accessibility"));
    }

    @Test
    void shouldGroupByPrimaryAndDeduplicate() {
        TagResolution resolution = resolver.resolve(List.of("Supabase", "OpenAI", "supabase", "Claude"), null);

        assertEquals(List.of(
                TagAssignment.of("Integration", "Supabase"),
                TagAssignment.of("AI Model", "OpenAI", "Claude")), resolution.assignments());
    }

    @Test
    void shouldBeIdempotentOnceNamesAreRegistered() {
        List<String> proposals = List.of("Open AI", "agent mode", "Figma Import");
        TagResolution first = resolver.resolve(proposals, null);
        int mutationsAfterFirst = index.mutationCount();

        TagResolution second = resolver.resolve(proposals, null);

        assertEquals(mutationsAfterFirst, index.mutationCount());
        assertEquals(first.assignments(), second.assignments());
        assertTrue(second.newlyCreated().isEmpty());
    }

    @Test
    void shouldReturnEmptyResolutionForNullProposals() {
        assertTrue(resolver.resolve(null, null).isEmpty());
    }

    @Test
    void shouldDropCatchAllNameBeforeCatchAllExists() {
        // Given
        assertFalse(index.hasPrimary("Others"));

        // When
        TagResolution resolution = resolver.resolve(List.of("Others", "other s", "Claude"), null);

        // Then
        assertEquals(List.of(TagAssignment.of("AI Model", "Claude")), resolution.assignments());
        assertEquals(List.of("Others", "other s"), resolution.droppedAsInvalid());
        assertTrue(resolution.newlyCreated().isEmpty());
        assertFalse(index.hasPrimary("Others"));
    }

    @Test
    void shouldDropProposalWhenCatchAllCannotBeCreated() {
        // Given a subtag already holds the catch-all name
        index.registerNewSubtag("Integration", "Others");

        // When
        TagResolution resolution = assertDoesNotThrow(
                () -> resolver.resolve(List.of("Voice Input", "Claude"), null));

        // Then
        assertEquals(List.of(TagAssignment.of("AI Model", "Claude")), resolution.assignments());
        assertEquals(List.of("Voice Input"), resolution.droppedAsInvalid());
        assertTrue(index.resolveSubtag("Voice Input").isEmpty());
    }
}
