package com.eainde.labaudit.normalize;

import com.eainde.labaudit.model.ExperimentType;
import com.eainde.labaudit.model.VisionObservation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the optional {@code EXPERIMENT_TYPE:} and {@code IMAGE_QUALITY:} header markers
 * from a vision description. Neither marker is required.
 */
public class VisionResponseNormalizer {

    static final String TYPE_MARKER = "EXPERIMENT_TYPE:";
    static final String QUALITY_MARKER = "IMAGE_QUALITY:";
    static final int HEADER_SCAN_LINES = 5;

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d{1,3}(?:\\.\\d+)?)");

    public VisionObservation normalize(String description) {
        if (description == null || description.isBlank()) {
            return new VisionObservation(ExperimentType.OTHER, null, "");
        }

        ExperimentType type = null;
        Integer quality = null;
        int scanned = 0;
        for (String line : description.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            if (scanned++ >= HEADER_SCAN_LINES) {
                break;
            }
            String upper = line.toUpperCase(Locale.ROOT);
            if (type == null && upper.contains(TYPE_MARKER)) {
                type = ExperimentType.fromLabel(afterMarker(upper, TYPE_MARKER));
            }
            if (quality == null && upper.contains(QUALITY_MARKER)) {
                quality = parseQuality(afterMarker(upper, QUALITY_MARKER));
            }
        }
        return new VisionObservation(type == null ? ExperimentType.OTHER : type, quality, description);
    }

    /** Returns 1-10, or null for anything absent or out of range. Fractional ratings round half up. */
    static Integer parseQuality(String value) {
        Matcher matcher = FIRST_NUMBER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        long quality = Math.round(Double.parseDouble(matcher.group(1)));
        return quality >= 1 && quality <= 10 ? (int) quality : null;
    }

    private static String afterMarker(String line, String marker) {
        return line.substring(line.indexOf(marker) + marker.length());
    }
}
