package com.eainde.labaudit.model;

import java.io.Serializable;

/**
 * Reconciled experiment-type signals for one audit.
 *
 * @param declared        type from the vision model's explicit tag
 * @param fromDescription type inferred from keywords in the description text
 * @param detected        best available detection (declared first, then keywords)
 * @param expected        type the protocol expects, null if the protocol names none
 * @param mismatch        true when a confident detection disagrees with the protocol
 */
public record ExperimentCheck(
        ExperimentType declared,
        ExperimentType fromDescription,
        ExperimentType detected,
        ExperimentType expected,
        boolean mismatch
) implements Serializable {

    public static ExperimentCheck none() {
        return new ExperimentCheck(ExperimentType.OTHER, ExperimentType.OTHER, ExperimentType.OTHER, null, false);
    }
}
