package com.eainde.labaudit.model;

import java.util.List;

/**
 * Everything one audit run produced: the canonical record plus the raw model output
 * and the signals behind it, kept for transparency.
 *
 * @param record          canonical audit record, never null
 * @param trail           stages the run passed through, in order
 * @param visionText      raw vision description (or rendered vision error), null if never reached
 * @param reasoningText   raw reasoning output, null if the reasoning call was skipped or failed
 * @param experimentCheck experiment-type reconciliation
 * @param visionCached    whether the vision description came from the cache
 * @param reasoningCached whether the reasoning output came from the cache
 */
public record AuditResult(
        AuditRecord record,
        List<AuditStage> trail,
        String visionText,
        String reasoningText,
        ExperimentCheck experimentCheck,
        boolean visionCached,
        boolean reasoningCached
) {

    public AuditResult {
        trail = trail == null ? List.of() : List.copyOf(trail);
        experimentCheck = experimentCheck == null ? ExperimentCheck.none() : experimentCheck;
    }

    public static AuditResult failed(AuditRecord record) {
        return new AuditResult(record, List.of(AuditStage.UPLOADED, AuditStage.COMPLETE),
                null, null, ExperimentCheck.none(), false, false);
    }

    /** Last stage reached. */
    public AuditStage stage() {
        return trail.isEmpty() ? AuditStage.UPLOADED : trail.get(trail.size() - 1);
    }
}
