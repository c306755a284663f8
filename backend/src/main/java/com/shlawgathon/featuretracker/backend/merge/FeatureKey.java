package com.shlawgathon.featuretracker.backend.merge;

import com.shlawgathon.featuretracker.backend.model.Feature;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Stable identity of a feature across re-scrapes: the first 16 hex chars of the MD5 of the title, then the time.
 * Descriptions do not take part, so reworded entries keep their identity. Never persisted.
 */
public record FeatureKey(String value) {

    private static final int HASH_LENGTH = 16;

    public static FeatureKey of(String title, String time) {
        String safeTitle = title != null ? title : "";
        String safeTime = time != null ? time : "";
        String hash = DigestUtils.md5DigestAsHex(safeTitle.getBytes(StandardCharsets.UTF_8));
        return new FeatureKey(hash.substring(0, HASH_LENGTH) + "_" + safeTime);
    }

    public static FeatureKey of(Feature feature) {
        return of(feature.getTitle(), feature.getTime());
    }

    @Override
    public String toString() {
        return value;
    }
}
