package com.shlawgathon.featuretracker.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Second-level taxonomy node.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Subtag {

    private String name;
    private String description;
}
