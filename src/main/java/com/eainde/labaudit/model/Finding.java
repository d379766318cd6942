package com.eainde.labaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A discrete, severity-ranked discrepancy between the observed image and the protocol.
 *
 * <p>Findings are only ever removed from an audit (phantom filtering) or prepended
 * (mismatch override), never edited in place. Text fields are never null.</p>
 */
public record Finding(
        @JsonProperty("id")              String id,
        @JsonProperty("severity")        Severity severity,
        @JsonProperty("category")        String category,
        @JsonProperty("observation")     String observation,
        @JsonProperty("sop_requirement") String sopRequirement,
        @JsonProperty("discrepancy")     String discrepancy,
        @JsonProperty("impact")          String impact,
        @JsonProperty("recommendation")  String recommendation
) implements Serializable {

    public Finding {
        id = id == null ? "" : id;
        severity = severity == null ? Severity.UNRATED : severity;
        category = category == null ? "" : category;
        observation = observation == null ? "" : observation;
        sopRequirement = sopRequirement == null ? "" : sopRequirement;
        discrepancy = discrepancy == null ? "" : discrepancy;
        impact = impact == null ? "" : impact;
        recommendation = recommendation == null ? "" : recommendation;
    }

    /** Text the phantom filter inspects. */
    public String assessedText() {
        return observation + " " + discrepancy + " " + impact;
    }
}
