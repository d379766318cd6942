package com.eainde.labaudit.model;

import java.util.Locale;

public enum ComplianceStatus {
    COMPLIANT,
    NON_COMPLIANT,
    UNABLE_TO_ASSESS,
    UNRECOGNIZED;

    /**
     * Accepts the spellings reasoning models actually produce:
     * {@code NON-COMPLIANT}, {@code non compliant}, {@code UNABLE TO ASSESS}, ...
     */
    public static ComplianceStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNRECOGNIZED;
        }
        String normalized = label.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("[\\s\\-]+", "_");
        for (ComplianceStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return UNRECOGNIZED;
    }
}
