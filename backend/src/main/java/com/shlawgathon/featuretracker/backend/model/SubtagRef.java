package com.shlawgathon.featuretracker.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a subtag inside a feature's tag assignment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubtagRef {

    private String name;

    public static SubtagRef of(String name) {
        return new SubtagRef(name);
    }
}
