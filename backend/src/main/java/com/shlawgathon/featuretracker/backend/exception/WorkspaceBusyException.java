package com.shlawgathon.featuretracker.backend.exception;

/**
 * Thrown when an admin mutation cannot acquire the workspace lock because a batch run holds it.
 */
public class WorkspaceBusyException extends RuntimeException {

    public WorkspaceBusyException(String message) {
        super(message);
    }
}
