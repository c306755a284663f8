package com.shlawgathon.featuretracker.backend.crawler;

import com.shlawgathon.featuretracker.backend.util.FeatureTime;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a hand-maintained markdown changelog into entries.
 * <pre>
 * ## v2.7.4 – January 12, 2026
 * ### Features
 * #### Feature Title
 * Feature description...
 * ### Patches
 * - **Editor:** Fixed something
 * - Plain bullet used as title
 * ---
 * </pre>
 * Dates in version headers are normalized to {@code YYYY-MM-DD} when recognised.
 */
public class ChangelogMarkdownParser {

    private static final Pattern VERSION_HEADER = Pattern.compile("^## (v[\\d.]+)\\s*[–-]\\s*(.+)$");
    private static final Pattern BOLD_TITLE = Pattern.compile("^\\*\\*(.+?):\\*\\*\\s*(.+)$");

    public List<ScrapedFeature> parse(String content) {
        List<ScrapedFeature> features = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return features;
        }

        Entry current = null;
        String currentDate = "";

        for (String line : content.split("\\R")) {
            String stripped = line.strip();

            Matcher version = VERSION_HEADER.matcher(stripped);
            if (version.matches()) {
                flush(current, features);
                current = null;
                currentDate = FeatureTime.normalizeDate(version.group(2));
                continue;
            }

            if (stripped.startsWith("### ")) {
                flush(current, features);
                current = null;
                continue;
            }

            if (stripped.startsWith("#### ")) {
                flush(current, features);
                current = new Entry(stripped.substring(5).strip(), currentDate);
                continue;
            }

            if (stripped.startsWith("- ")) {
                flush(current, features);
                String item = stripped.substring(2).strip();
                Matcher bold = BOLD_TITLE.matcher(item);
                if (bold.matches()) {
                    current = new Entry(bold.group(1).strip(), currentDate);
                    current.description.add(bold.group(2).strip());
                } else {
                    current = new Entry(item, currentDate);
                }
                continue;
            }

            if (current != null && !stripped.isEmpty()) {
                if (stripped.equals("---")) {
                    flush(current, features);
                    current = null;
                } else {
                    current.description.add(stripped);
                }
            }
        }
        flush(current, features);
        return features;
    }

    private static void flush(Entry entry, List<ScrapedFeature> out) {
        if (entry != null && !entry.title.isEmpty()) {
            out.add(new ScrapedFeature(entry.title, String.join("\n", entry.description).strip(), entry.date));
        }
    }

    private static final class Entry {
        private final String title;
        private final String date;
        private final List<String> description = new ArrayList<>();

        private Entry(String title, String date) {
            this.title = title;
            this.date = date;
        }
    }
}
