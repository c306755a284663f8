package com.shlawgathon.featuretracker.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Markdown changelog maintained by hand for a product that has no public changelog page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "raw_changelogs")
public class RawChangelog {

    @Id
    private String productName;

    private String content;

    @LastModifiedDate
    private Instant updatedAt;
}
