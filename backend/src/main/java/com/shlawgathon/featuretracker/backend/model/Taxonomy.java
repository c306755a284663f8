package com.shlawgathon.featuretracker.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tag taxonomy: primary tags with their subtags plus the subtag to primary reverse index.
 * <p>
 * Stored as a single document; mutate it through
 * {@link com.shlawgathon.featuretracker.backend.taxonomy.TaxonomyIndex} so the reverse index stays in sync.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "taxonomy")
public class Taxonomy {

    public static final String DEFAULT_ID = "default";

    @Id
    @JsonIgnore
    @Builder.Default
    private String id = DEFAULT_ID;

    @Field("primary_tags")
    @JsonProperty("primary_tags")
    @Builder.Default
    private List<PrimaryTag> primaryTags = new ArrayList<>();

    @Field("subtag_to_primary")
    @JsonProperty("subtag_to_primary")
    @Builder.Default
    private Map<String, String> subtagToPrimary = new LinkedHashMap<>();

    @LastModifiedDate
    private Instant updatedAt;

    public static Taxonomy empty() {
        return Taxonomy.builder().build();
    }

    @JsonIgnore
    public List<PrimaryTag> primaryTagsOrEmpty() {
        if (primaryTags == null) {
            primaryTags = new ArrayList<>();
        }
        return primaryTags;
    }

    @JsonIgnore
    public Map<String, String> subtagToPrimaryOrEmpty() {
        if (subtagToPrimary == null) {
            subtagToPrimary = new LinkedHashMap<>();
        }
        return subtagToPrimary;
    }
}
