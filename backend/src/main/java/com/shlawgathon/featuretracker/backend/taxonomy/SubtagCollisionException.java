package com.shlawgathon.featuretracker.backend.taxonomy;

import com.shlawgathon.featuretracker.backend.exception.TaxonomyConflictException;

/**
 * Raised when a subtag is registered under one primary while an equivalent name already belongs to another.
 * Callers fold the proposal into {@link #getExistingName()} instead of registering it.
 */
public class SubtagCollisionException extends TaxonomyConflictException {

    private final String existingName;
    private final String existingPrimary;

    public SubtagCollisionException(String proposedName, String existingName, String existingPrimary,
            String requestedPrimary) {
        super("Subtag '" + proposedName + "' collides with '" + existingName + "' under '" + existingPrimary
                + "', cannot register it under '" + requestedPrimary + "'");
        this.existingName = existingName;
        this.existingPrimary = existingPrimary;
    }

    public String getExistingName() {
        return existingName;
    }

    public String getExistingPrimary() {
        return existingPrimary;
    }
}
