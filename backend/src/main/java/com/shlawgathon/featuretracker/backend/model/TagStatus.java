package com.shlawgathon.featuretracker.backend.model;

/**
 * Classification status of a stored feature.
 */
public enum TagStatus {
    /** Never classified, reset by an admin, or left pending after an oracle failure. */
    UNTAGGED,
    /** Classified as not a classifiable feature (bug fixes, non-functional notes). */
    NOT_APPLICABLE,
    TAGGED
}
