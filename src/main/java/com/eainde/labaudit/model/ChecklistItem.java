package com.eainde.labaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One protocol-derived compliance criterion with its tri-state assessment.
 *
 * @param criterion the protocol requirement being checked
 * @param status    assessment returned by the reasoning model
 * @param notes     short explanation, never null
 */
public record ChecklistItem(
        @JsonProperty("criterion") String criterion,
        @JsonProperty("status")    ComplianceStatus status,
        @JsonProperty("notes")     String notes
) implements Serializable {}
