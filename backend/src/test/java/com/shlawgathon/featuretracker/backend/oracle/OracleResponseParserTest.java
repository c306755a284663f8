package com.shlawgathon.featuretracker.backend.oracle;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser();

    @Test
    void shouldParsePlainJson() {
        Optional<OracleResponseParser.Proposal> proposal =
                parser.parse("{\"subtags\": [\"OpenAI\", \"Agent Mode\"], \"primary_hint\": \"AI Model\"}");

        assertTrue(proposal.isPresent());
        assertEquals(List.of("OpenAI", "Agent Mode"), proposal.get().subtags());
        assertEquals("AI Model", proposal.get().primaryHint());
    }

    @Test
    void shouldParseFencedBlockWithSurroundingProse() {
        String reply = """
                Here is the classification:
                ```json
                {"subtags": ["Supabase"], "primary_hint": null}
                ```
                """;

        OracleResponseParser.Proposal proposal = parser.parse(reply).orElseThrow();

        assertEquals(List.of("Supabase"), proposal.subtags());
        assertNull(proposal.primaryHint());
    }

    @Test
    void shouldParseEmbeddedObject() {
        String reply = "I think {\"subtags\": [\"Figma\"]} fits best.";

        assertEquals(List.of("Figma"), parser.parse(reply).orElseThrow().subtags());
    }

    @Test
    void shouldTolerateTrailingCommasAndObjectItems() {
        String reply = "{\"subtags\": [{\"name\": \"Claude\"}, \"Gemini\",],}";

        assertEquals(List.of("Claude", "Gemini"), parser.parse(reply).orElseThrow().subtags());
    }

    @Test
    void shouldReturnEmptyListForNotApplicable() {
        assertEquals(List.of(), parser.parse("{\"subtags\": []}").orElseThrow().subtags());
    }

    @Test
    void shouldRejectUnparsableReplies() {
        assertTrue(parser.parse("Sorry, I cannot help with that.").isEmpty());
        assertTrue(parser.parse("{\"tags\": [\"OpenAI\"]}").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
