package com.shlawgathon.featuretracker.backend.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangelogMarkdownParserTest {

    private final ChangelogMarkdownParser parser = new ChangelogMarkdownParser();

    private static final String CHANGELOG = """
            # Changelog

            ## v2.7.4 – January 12, 2026
            ### Features
            #### Figma Import
            Import frames straight from Figma.
            Layers are kept.

            ### Patches
            - **Editor:** Fixed cursor jumps
            - Faster preview builds
            ---
            ## v2.7.3 - Jan 5, 2026
            #### Dark Mode
            Toggle in settings.
            """;

    @Test
    void shouldParseTitledBlocksAndBullets() {
        List<ScrapedFeature> features = parser.parse(CHANGELOG);

        assertEquals(4, features.size());
        assertEquals(new ScrapedFeature("Figma Import",
                "Import frames straight from Figma.\nLayers are kept.", "2026-01-12"), features.get(0));
        assertEquals(new ScrapedFeature("Editor", "Fixed cursor jumps", "2026-01-12"), features.get(1));
        assertEquals(new ScrapedFeature("Faster preview builds", "", "2026-01-12"), features.get(2));
        assertEquals(new ScrapedFeature("Dark Mode", "Toggle in settings.", "2026-01-05"), features.get(3));
    }

    @Test
    void shouldKeepUnrecognisedDatesVerbatim() {
        List<ScrapedFeature> features = parser.parse("## v1.0 – Spring 2025\n#### Launch\nHello");

        assertEquals("Spring 2025", features.get(0).time());
    }

    @Test
    void shouldIgnoreTextOutsideEntries() {
        assertTrue(parser.parse("Just some notes\nwithout headers").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }
}
