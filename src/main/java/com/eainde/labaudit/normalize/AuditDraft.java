package com.eainde.labaudit.normalize;

import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStatus;
import com.eainde.labaudit.model.ChecklistItem;
import com.eainde.labaudit.model.Finding;

import java.io.Serializable;
import java.util.List;

/**
 * Structured content of a parsed reasoning response, before the engine has scored it.
 * Whatever score or status the model proposed is not carried over.
 */
public record AuditDraft(
        String summary,
        List<Finding> findings,
        List<ChecklistItem> checklist,
        String riskAssessment,
        List<String> recommendedActions
) implements Serializable {

    public AuditDraft {
        findings = findings == null ? List.of() : List.copyOf(findings);
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }

    public AuditRecord toRecord(List<Finding> scoredFindings, int score, AuditStatus status) {
        return new AuditRecord(score, status, summary, scoredFindings, checklist,
                riskAssessment, recommendedActions, null);
    }
}
