package com.shlawgathon.featuretracker.backend.model;

/**
 * Outcome of monitoring one product.
 */
public enum MonitorOutcome {
    SUCCESS,
    NO_CRAWLER,
    CRAWLER_FAILED,
    EMPTY_RESULT,
    FAILED
}
