package com.eainde.labaudit.model;

import java.io.Serializable;
import java.util.OptionalInt;

/**
 * Structured view of one vision-model description.
 *
 * @param experimentType type declared by the {@code EXPERIMENT_TYPE:} marker, {@code OTHER} if absent
 * @param imageQuality   1-10 rating from the {@code IMAGE_QUALITY:} marker, null when unknown
 * @param text           full description text
 */
public record VisionObservation(
        ExperimentType experimentType,
        Integer imageQuality,
        String text
) implements Serializable {

    public VisionObservation {
        experimentType = experimentType == null ? ExperimentType.OTHER : experimentType;
        text = text == null ? "" : text;
    }

    public OptionalInt quality() {
        return imageQuality == null ? OptionalInt.empty() : OptionalInt.of(imageQuality);
    }
}
