package com.eainde.labaudit.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Experiment types the engine can tell apart. Anything else is {@link #OTHER}.
 */
public enum ExperimentType {
    MTT_CELL_VIABILITY("MTT cell viability assay"),
    GEL_ELECTROPHORESIS("gel electrophoresis"),
    HPLC_CHROMATOGRAPHY("HPLC chromatography"),
    COLONY_COUNTING("bacterial colony counting"),
    OTHER("unclassified experiment");

    private static final Pattern LABEL_TOKEN = Pattern.compile("[A-Z][A-Z_]*");

    private final String displayName;

    ExperimentType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a tag value such as {@code "GEL_ELECTROPHORESIS"} or
     * {@code "**HPLC_CHROMATOGRAPHY** (peaks visible)"}. The first upper-case token
     * that names a known type wins.
     */
    public static ExperimentType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        Matcher matcher = LABEL_TOKEN.matcher(label.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            for (ExperimentType type : values()) {
                if (type.name().equals(token)) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
