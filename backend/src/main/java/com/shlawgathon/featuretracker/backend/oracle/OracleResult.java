package com.shlawgathon.featuretracker.backend.oracle;

import java.util.List;

/**
 * Answer of the classification oracle for one feature.
 *
 * @param outcome       what kind of answer this is
 * @param proposedNames subtag names proposed by the oracle (only for {@link Outcome#PROPOSED})
 * @param primaryHint   optional primary tag under which unknown proposals should be registered
 * @param failureReason last error when {@link Outcome#FAILED}
 */
public record OracleResult(
        Outcome outcome,
        List<String> proposedNames,
        String primaryHint,
        String failureReason
) {

    public enum Outcome {
        PROPOSED,
        NOT_CLASSIFIABLE,
        FAILED
    }

    public static OracleResult proposed(List<String> names, String primaryHint) {
        if (names == null || names.isEmpty()) {
            return notClassifiable();
        }
        return new OracleResult(Outcome.PROPOSED, List.copyOf(names), primaryHint, null);
    }

    public static OracleResult notClassifiable() {
        return new OracleResult(Outcome.NOT_CLASSIFIABLE, List.of(), null, null);
    }

    public static OracleResult failed(String reason) {
        return new OracleResult(Outcome.FAILED, List.of(), null, reason);
    }
}
