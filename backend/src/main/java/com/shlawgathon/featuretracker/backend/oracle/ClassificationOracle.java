package com.shlawgathon.featuretracker.backend.oracle;

import com.shlawgathon.featuretracker.backend.model.Taxonomy;

/**
 * External classifier proposing subtag names for a feature.
 * <p>
 * Implementations handle their own retries and timeouts and report exhaustion as
 * {@link OracleResult#failed(String)} instead of throwing.
 */
public interface ClassificationOracle {

    OracleResult classify(String title, String description, Taxonomy taxonomy);
}
