package com.shlawgathon.featuretracker.backend.exception;

/**
 * Thrown when a product, feature index or taxonomy node does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
