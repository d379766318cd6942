package com.eainde.labaudit.model;

import java.util.Locale;

/**
 * Severity of a single audit finding.
 *
 * <p>{@link #UNRATED} covers labels the reasoning model invented; such findings carry no
 * penalty and are never filtered out.</p>
 */
public enum Severity {
    CRITICAL,
    MAJOR,
    MINOR,
    OBSERVATION,
    UNRATED;

    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNRATED;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return UNRATED;
    }

    /** Low-severity findings are the only ones the phantom filter may drop. */
    public boolean isLow() {
        return this == MINOR || this == OBSERVATION;
    }
}
