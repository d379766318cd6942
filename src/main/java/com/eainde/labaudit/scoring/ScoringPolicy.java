package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.Severity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Constants of the integrity score.
 *
 * <p>An unverifiable criterion earns {@code unableCredit} of a compliant one. Each
 * filtered finding subtracts its severity weight. The default numbers are policy, not
 * a cited standard; they only have to stay fixed for scores to stay reproducible.</p>
 *
 * @param unableCredit         credit for an UNABLE_TO_ASSESS item, 0..1
 * @param severityWeights      penalty points per finding severity
 * @param neutralScore         raw score used when the checklist is empty
 * @param passThreshold        lowest score that passes
 * @param investigateThreshold lowest score that needs investigation rather than failing
 */
public record ScoringPolicy(
        double unableCredit,
        Map<Severity, Integer> severityWeights,
        int neutralScore,
        int passThreshold,
        int investigateThreshold
) {

    public static final double DEFAULT_UNABLE_CREDIT = 0.25;
    public static final int DEFAULT_NEUTRAL_SCORE = 50;
    public static final int DEFAULT_PASS_THRESHOLD = 80;
    public static final int DEFAULT_INVESTIGATE_THRESHOLD = 50;

    public ScoringPolicy {
        if (unableCredit < 0.0 || unableCredit > 1.0) {
            throw new IllegalArgumentException("unableCredit must be within [0, 1]: " + unableCredit);
        }
        if (neutralScore < 0 || neutralScore > 100) {
            throw new IllegalArgumentException("neutralScore must be within [0, 100]: " + neutralScore);
        }
        if (investigateThreshold > passThreshold) {
            throw new IllegalArgumentException("investigateThreshold " + investigateThreshold
                    + " must not exceed passThreshold " + passThreshold);
        }
        EnumMap<Severity, Integer> weights = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            Integer weight = severityWeights == null ? null : severityWeights.get(severity);
            int value = weight == null ? 0 : weight;
            if (value < 0) {
                throw new IllegalArgumentException("Severity weight must not be negative: " + severity + "=" + value);
            }
            weights.put(severity, value);
        }
        severityWeights = Map.copyOf(weights);
    }

    public static ScoringPolicy defaults() {
        return of(15, 10, 5, 2);
    }

    public static ScoringPolicy of(int critical, int major, int minor, int observation) {
        return new ScoringPolicy(
                DEFAULT_UNABLE_CREDIT,
                Map.of(Severity.CRITICAL, critical,
                        Severity.MAJOR, major,
                        Severity.MINOR, minor,
                        Severity.OBSERVATION, observation),
                DEFAULT_NEUTRAL_SCORE,
                DEFAULT_PASS_THRESHOLD,
                DEFAULT_INVESTIGATE_THRESHOLD);
    }

    public int weightOf(Severity severity) {
        return severityWeights.getOrDefault(severity, 0);
    }
}
