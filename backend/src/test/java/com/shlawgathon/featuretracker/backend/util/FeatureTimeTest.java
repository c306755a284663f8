package com.shlawgathon.featuretracker.backend.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTimeTest {

    @Test
    void shouldNormalizeLongDates() {
        assertEquals("2026-01-12", FeatureTime.normalizeDate("January 12, 2026"));
        assertEquals("2026-01-05", FeatureTime.normalizeDate(" Jan 5, 2026 "));
        assertEquals("January 2026", FeatureTime.normalizeDate("January 2026"));
        assertEquals("", FeatureTime.normalizeDate(null));
    }

    @Test
    void shouldBuildSortableKeys() {
        assertEquals(Optional.of("2026-01-12"), FeatureTime.sortKey("2026-01-12"));
        assertEquals(Optional.of("2026-01"), FeatureTime.sortKey("January 2026"));
        assertEquals(Optional.of("2025-12"), FeatureTime.sortKey("Dec 2025"));
        assertTrue(FeatureTime.sortKey("soon").isEmpty());
        assertTrue(FeatureTime.sortKey("").isEmpty());
    }

    @Test
    void shouldSortNewestFirstWithUnknownLast() {
        List<String> times = new ArrayList<>(List.of("2025-12-01", "unknown", "January 2026", "2026-01-12"));

        times.sort(FeatureTime.NEWEST_FIRST);

        assertEquals(List.of("2026-01-12", "January 2026", "2025-12-01", "unknown"), times);
    }

    @Test
    void shouldPickLatestInOriginalSpelling() {
        assertEquals(Optional.of("Feb 3, 2026"),
                FeatureTime.latest(Arrays.asList("2026-01-12", null, "Feb 3, 2026", "???")));
        assertTrue(FeatureTime.latest(List.of()).isEmpty());
    }
}
