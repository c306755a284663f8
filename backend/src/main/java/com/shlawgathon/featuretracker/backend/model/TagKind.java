package com.shlawgathon.featuretracker.backend.model;

/**
 * The two taxonomy namespaces.
 */
public enum TagKind {
    PRIMARY,
    SUBTAG
}
