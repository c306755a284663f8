package com.shlawgathon.featuretracker.backend.taxonomy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    @Test
    void shouldFoldCaseSpacesHyphensAndUnderscores() {
        assertEquals("openai", NameNormalizer.normalize("OpenAI"));
        assertEquals("openai", NameNormalizer.normalize("Open AI"));
        assertEquals("openai", NameNormalizer.normalize(" open-ai "));
        assertEquals("openai", NameNormalizer.normalize("OPEN_AI"));
    }

    @Test
    void shouldKeepOtherPunctuation() {
        assertEquals("next.js", NameNormalizer.normalize("Next.js"));
        assertEquals("c++", NameNormalizer.normalize("C++"));
    }

    @Test
    void shouldBeIdempotent() {
        for (String name : new String[]{"Agent Mode", "GPT-4o", "supabase_auth", "  X  ", ""}) {
            String once = NameNormalizer.normalize(name);
            assertEquals(once, NameNormalizer.normalize(once));
        }
    }

    @Test
    void shouldNormalizeNullToEmpty() {
        assertEquals("", NameNormalizer.normalize(null));
        assertTrue(NameNormalizer.sameName(null, "  "));
    }

    @Test
    void shouldCompareNames() {
        assertTrue(NameNormalizer.sameName("Agent Mode", "agent-mode"));
        assertFalse(NameNormalizer.sameName("Agent Mode", "Agents Mode"));
    }
}
