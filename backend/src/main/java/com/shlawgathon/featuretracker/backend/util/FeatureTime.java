package com.shlawgathon.featuretracker.backend.util;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for the loosely formatted {@code time} field of scraped features.
 * <p>
 * Accepted forms: {@code 2026-01-12}, {@code January 2026} / {@code Jan 2026}, and the long dates changelogs
 * print ({@code January 12, 2026}, {@code Jan 12, 2026}).
 */
public final class FeatureTime {

    private static final List<DateTimeFormatter> DAY_FORMATS = List.of(
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH));

    private static final List<DateTimeFormatter> MONTH_FORMATS = List.of(
            DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH));

    /** Newest first; unparseable values last. */
    public static final Comparator<String> NEWEST_FIRST = Comparator
            .comparing((String t) -> sortKey(t).orElse(""))
            .reversed();

    private FeatureTime() {
    }

    /**
     * Normalizes a changelog date to {@code YYYY-MM-DD}. Values that are not recognised are returned trimmed.
     */
    public static String normalizeDate(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DAY_FORMATS) {
            Optional<LocalDate> parsed = parseDay(value, format);
            if (parsed.isPresent()) {
                return parsed.get().toString();
            }
        }
        return value;
    }

    /**
     * Lexically sortable key: {@code YYYY-MM-DD} for day dates, {@code YYYY-MM} for month-only dates.
     */
    public static Optional<String> sortKey(String time) {
        if (time == null || time.isBlank()) {
            return Optional.empty();
        }
        String value = time.trim();
        Optional<LocalDate> iso = parseDay(value, DateTimeFormatter.ISO_LOCAL_DATE);
        if (iso.isPresent()) {
            return Optional.of(iso.get().toString());
        }
        String normalized = normalizeDate(value);
        if (!normalized.equals(value)) {
            return Optional.of(normalized);
        }
        for (DateTimeFormatter format : MONTH_FORMATS) {
            Optional<YearMonth> month = parseMonth(value, format);
            if (month.isPresent()) {
                return Optional.of(month.get().toString());
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> parseDay(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<YearMonth> parseMonth(String value, DateTimeFormatter format) {
        try {
            return Optional.of(YearMonth.parse(value, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Most recent date among {@code times}, in its original spelling.
     */
    public static Optional<String> latest(List<String> times) {
        return times.stream()
                .filter(Objects::nonNull)
                .filter(t -> sortKey(t).isPresent())
                .max(Comparator.comparing((String t) -> sortKey(t).orElseThrow()));
    }
}
