package com.eainde.labaudit.normalize;

import com.eainde.labaudit.model.ChecklistItem;
import com.eainde.labaudit.model.ComplianceStatus;
import com.eainde.labaudit.model.Finding;
import com.eainde.labaudit.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the reasoning model's free-form answer into an {@link AuditDraft}.
 *
 * <p>Permissive on input (prose, code fences, partial field sets, alternative spellings
 * of status labels), strict on output shape: every list is non-null, every text field
 * is a string, every finding has an id.</p>
 */
@Slf4j
public class AuditResponseNormalizer {

    static final String CHECKLIST_FIELD = "sop_compliance_checklist";
    static final String CHECKLIST_ALIAS = "checklist";

    private final JsonExtraction jsonExtraction;

    public AuditResponseNormalizer(JsonExtraction jsonExtraction) {
        this.jsonExtraction = jsonExtraction;
    }

    public NormalizedAudit normalize(String rawText) {
        Optional<JsonNode> root = jsonExtraction.extract(rawText);
        if (root.isEmpty()) {
            log.warn("Reasoning output could not be parsed by any strategy ({} chars) - PARSE_ERROR",
                    rawText == null ? 0 : rawText.length());
            return NormalizedAudit.unparseable(rawText == null ? "" : rawText);
        }
        JsonNode json = root.get();
        if (json.has("data_integrity_score")) {
            log.debug("Discarding model-proposed score {}", json.get("data_integrity_score"));
        }

        AuditDraft draft = new AuditDraft(
                text(json, "summary"),
                findings(json.path("findings")),
                checklist(json.has(CHECKLIST_FIELD) ? json.get(CHECKLIST_FIELD) : json.path(CHECKLIST_ALIAS)),
                text(json, "risk_assessment"),
                strings(json.path("recommended_actions")));

        log.debug("Normalized reasoning output: {} findings, {} checklist items",
                draft.findings().size(), draft.checklist().size());
        return NormalizedAudit.parsed(draft);
    }

    // =========================================================================
    //  Field mapping
    // =========================================================================

    private List<Finding> findings(JsonNode array) {
        List<Finding> findings = new ArrayList<>();
        if (!array.isArray()) {
            return findings;
        }
        int position = 0;
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            position++;
            String id = text(node, "id");
            findings.add(new Finding(
                    id.isBlank() ? String.format("F%03d", position) : id,
                    Severity.fromLabel(text(node, "severity")),
                    text(node, "category"),
                    text(node, "observation"),
                    text(node, "sop_requirement"),
                    text(node, "discrepancy"),
                    text(node, "impact"),
                    text(node, "recommendation")));
        }
        return findings;
    }

    private List<ChecklistItem> checklist(JsonNode array) {
        List<ChecklistItem> items = new ArrayList<>();
        if (!array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            items.add(new ChecklistItem(
                    text(node, "criterion"),
                    ComplianceStatus.fromLabel(text(node, "status")),
                    text(node, "notes")));
        }
        return items;
    }

    private List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = asText(element);
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String text(JsonNode parent, String field) {
        return asText(parent.path(field));
    }

    private static String asText(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
