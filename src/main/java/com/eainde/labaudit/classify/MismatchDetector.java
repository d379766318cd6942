package com.eainde.labaudit.classify;

import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStatus;
import com.eainde.labaudit.model.ExperimentCheck;
import com.eainde.labaudit.model.ExperimentType;
import com.eainde.labaudit.model.Finding;
import com.eainde.labaudit.model.Severity;
import com.eainde.labaudit.model.VisionObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reconciles what the image shows with what the selected protocol expects.
 *
 * <p>Signal priority: the vision model's explicit {@code EXPERIMENT_TYPE:} tag when it is
 * not {@code OTHER}, then description keywords. File names are never consulted.</p>
 *
 * <p>{@link #applyOverride} clamps an already scored record. It must run after the
 * deterministic scorer and is idempotent.</p>
 */
@Slf4j
public class MismatchDetector {

    public static final String MISMATCH_CATEGORY = "Experiment Type Mismatch";
    public static final String MISMATCH_FINDING_ID = "F000";
    public static final int DEFAULT_SCORE_CAP = 15;

    private final ExperimentTypeClassifier classifier;
    private final int scoreCap;

    public MismatchDetector(ExperimentTypeClassifier classifier) {
        this(classifier, DEFAULT_SCORE_CAP);
    }

    public MismatchDetector(ExperimentTypeClassifier classifier, int scoreCap) {
        this.classifier = classifier;
        this.scoreCap = scoreCap;
    }

    public ExperimentCheck check(VisionObservation observation, String protocolText) {
        ExperimentType declared = observation.experimentType();
        ExperimentType fromDescription = classifier.classifyDescription(observation.text());
        ExperimentType detected = declared != ExperimentType.OTHER ? declared : fromDescription;
        ExperimentType expected = classifier.expectedForProtocol(protocolText).orElse(null);

        boolean mismatch = expected != null
                && detected != ExperimentType.OTHER
                && detected != expected;

        if (mismatch) {
            log.warn("Experiment type mismatch: image shows {} (declared={}, keywords={}) but protocol expects {}",
                    detected, declared, fromDescription, expected);
        } else {
            log.debug("Experiment type check: detected={}, expected={}", detected, expected);
        }
        return new ExperimentCheck(declared, fromDescription, detected, expected, mismatch);
    }

    public AuditRecord applyOverride(AuditRecord scored, ExperimentCheck check) {
        if (check == null || !check.mismatch()) {
            return scored;
        }
        int computed = scored.score() == null ? 0 : scored.score();
        List<Finding> findings = scored.findings();
        if (findings.stream().noneMatch(MismatchDetector::describesMismatch)) {
            List<Finding> withMismatch = new ArrayList<>(findings.size() + 1);
            withMismatch.add(mismatchFinding(check));
            withMismatch.addAll(findings);
            findings = withMismatch;
        }
        return scored.withFindings(findings).withVerdict(Math.min(computed, scoreCap), AuditStatus.FAIL);
    }

    /** True only for a finding about the experiment type; other mismatches (labels, volumes) do not count. */
    static boolean describesMismatch(Finding finding) {
        String category = finding.category().toLowerCase(Locale.ROOT);
        return finding.category().equalsIgnoreCase(MISMATCH_CATEGORY)
                || category.contains("type mismatch")
                || finding.discrepancy().toLowerCase(Locale.ROOT).contains("experiment type mismatch");
    }

    private static Finding mismatchFinding(ExperimentCheck check) {
        String detected = check.detected().displayName();
        String expected = check.expected().displayName();
        return new Finding(
                MISMATCH_FINDING_ID,
                Severity.CRITICAL,
                MISMATCH_CATEGORY,
                "The image appears to show " + detected + ".",
                "The selected protocol applies to " + expected + ".",
                "Experiment type mismatch: detected " + check.detected() + ", protocol expects " + check.expected() + ".",
                "Compliance results against this protocol are not meaningful for this image.",
                "Select the protocol that matches the image, or upload the image that belongs to this protocol.");
    }

    public int getScoreCap() {
        return scoreCap;
    }
}
