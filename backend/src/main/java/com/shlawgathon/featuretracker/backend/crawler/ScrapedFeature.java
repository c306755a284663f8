package com.shlawgathon.featuretracker.backend.crawler;

import com.shlawgathon.featuretracker.backend.model.Feature;
import com.shlawgathon.featuretracker.backend.model.TagStatus;

import java.util.ArrayList;

/**
 * Raw changelog entry as produced by a crawler.
 */
public record ScrapedFeature(String title, String description, String time) {

    public boolean isValid() {
        return title != null && !title.isBlank();
    }

    public Feature toFeature() {
        return Feature.builder()
                .title(title.trim())
                .description(description != null ? description.trim() : "")
                .time(time != null ? time.trim() : "")
                .tagStatus(TagStatus.UNTAGGED)
                .tags(new ArrayList<>())
                .build();
    }
}
