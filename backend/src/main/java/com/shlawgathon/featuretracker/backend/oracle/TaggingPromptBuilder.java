package com.shlawgathon.featuretracker.backend.oracle;

import com.shlawgathon.featuretracker.backend.model.PrimaryTag;
import com.shlawgathon.featuretracker.backend.model.Subtag;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the classification prompt. The model only picks subtags; primary tags are derived from the taxonomy.
 */
public class TaggingPromptBuilder {

    private static final int MAX_DESCRIPTION_LENGTH = 3000;

    private final String fallbackPrimary;

    public TaggingPromptBuilder(String fallbackPrimary) {
        this.fallbackPrimary = fallbackPrimary;
    }

    public String build(String title, String description, Taxonomy taxonomy) {
        StringBuilder categories = new StringBuilder();
        TreeSet<String> primaryNames = new TreeSet<>();

        for (PrimaryTag primary : taxonomy.primaryTagsOrEmpty()) {
            if (primary.getName().equals(fallbackPrimary)) {
                continue;
            }
            primaryNames.add(primary.getName());
            List<String> subtags = primary.subtagsOrEmpty().stream().map(Subtag::getName).toList();
            if (!subtags.isEmpty()) {
                categories.append("[").append(primary.getName()).append("]: ")
                        .append(String.join(", ", subtags))
                        .append('\n');
            }
        }

        String safeDescription = description != null ? description : "";
        if (safeDescription.length() > MAX_DESCRIPTION_LENGTH) {
            safeDescription = safeDescription.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
        }

        return String.format("""
                You are a competitive analysis expert classifying product changelog entries.

                ## Available subtags (grouped by category)

                %s
                ## Entry to classify

                - Title: %s
                - Description: %s

                ## Task

                Pick the 1-2 most accurate subtags. Prefer existing subtags; avoid overlapping choices.
                Propose a new subtag only when the entry names a concrete service, model or capability
                that is not listed. If you propose a new subtag you may set "primary_hint" to the category
                it belongs to.

                ## Rules

                1. Never return a category name as a subtag. Category names: %s
                2. Integrations require the third-party service to be named explicitly.
                3. Pure bug fixes or non-functional notes get an empty list.

                Respond with ONLY valid JSON in this exact format (no markdown, no explanation):
                {
                  "subtags": ["subtag1", "subtag2"],
                  "primary_hint": null
                }
                """,
                categories,
                title != null ? title : "",
                safeDescription,
                primaryNames.stream().collect(Collectors.joining(", ")));
    }
}
