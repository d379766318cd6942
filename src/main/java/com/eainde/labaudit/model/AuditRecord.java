package com.eainde.labaudit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Canonical audit output consumed by presentation and report layers.
 *
 * <p>{@code score} and {@code status} are always engine-computed. {@code score} is null
 * for {@link AuditStatus#PARSE_ERROR} and {@link AuditStatus#INSUFFICIENT_QUALITY};
 * {@code rawResponse} is only set for {@link AuditStatus#PARSE_ERROR}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditRecord(
        @JsonProperty("score")               Integer score,
        @JsonProperty("status")              AuditStatus status,
        @JsonProperty("summary")             String summary,
        @JsonProperty("findings")            List<Finding> findings,
        @JsonProperty("checklist")           List<ChecklistItem> checklist,
        @JsonProperty("risk_assessment")     String riskAssessment,
        @JsonProperty("recommended_actions") List<String> recommendedActions,
        @JsonProperty("raw_response")        String rawResponse
) implements Serializable {

    public AuditRecord {
        findings = findings == null ? List.of() : List.copyOf(findings);
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
        summary = summary == null ? "" : summary;
        riskAssessment = riskAssessment == null ? "" : riskAssessment;
    }

    public AuditRecord withVerdict(int newScore, AuditStatus newStatus) {
        return new AuditRecord(newScore, newStatus, summary, findings, checklist,
                riskAssessment, recommendedActions, rawResponse);
    }

    public AuditRecord withFindings(List<Finding> newFindings) {
        return new AuditRecord(score, status, summary, newFindings, checklist,
                riskAssessment, recommendedActions, rawResponse);
    }

    /** Terminal record for transport failures and invalid input. */
    public static AuditRecord error(String reason) {
        return new AuditRecord(
                0,
                AuditStatus.ERROR,
                "Audit could not be completed: " + reason,
                List.of(),
                List.of(),
                "Unable to assess due to an inference error.",
                List.of("Check the inference API key", "Verify model availability", "Try again"),
                null);
    }

    /** Terminal record for reasoning output that no extraction strategy could parse. */
    public static AuditRecord parseError(String rawText) {
        return new AuditRecord(
                null,
                AuditStatus.PARSE_ERROR,
                "The AI generated a response but it could not be parsed as structured data. "
                        + "Raw response is attached.",
                List.of(),
                List.of(),
                rawText,
                List.of("Review raw AI output manually"),
                rawText);
    }

    /** Terminal record for images rejected by the quality gate. */
    public static AuditRecord insufficientQuality(int imageQuality) {
        return new AuditRecord(
                null,
                AuditStatus.INSUFFICIENT_QUALITY,
                "Image quality was rated " + imageQuality + "/10, too low for a reliable audit. "
                        + "The protocol comparison was not performed.",
                List.of(),
                List.of(),
                "Evidence is not legible enough to assess compliance.",
                List.of("Re-capture the image with adequate focus, lighting and resolution",
                        "Run the audit again on the new image"),
                null);
    }
}
