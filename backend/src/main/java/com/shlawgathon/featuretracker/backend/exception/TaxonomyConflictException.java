package com.shlawgathon.featuretracker.backend.exception;

/**
 * Thrown when a taxonomy change would break name uniqueness or mix the primary and subtag namespaces.
 */
public class TaxonomyConflictException extends RuntimeException {

    public TaxonomyConflictException(String message) {
        super(message);
    }
}
