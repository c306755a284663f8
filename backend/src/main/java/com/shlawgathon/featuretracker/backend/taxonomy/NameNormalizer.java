package com.shlawgathon.featuretracker.backend.taxonomy;

import java.util.Locale;

/**
 * Canonical spelling of tag names for fuzzy matching.
 * <p>
 * "OpenAI", "Open AI" and "open-ai" all map to {@code openai}.
 */
public final class NameNormalizer {

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String lowered = name.toLowerCase(Locale.ROOT).trim();
        StringBuilder out = new StringBuilder(lowered.length());
        for (int i = 0; i < lowered.length(); i++) {
            char c = lowered.charAt(i);
            if (c != ' ' && c != '-' && c != '_') {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static boolean sameName(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
