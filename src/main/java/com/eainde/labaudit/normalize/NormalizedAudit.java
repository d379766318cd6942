package com.eainde.labaudit.normalize;

import com.eainde.labaudit.model.AuditRecord;

/**
 * Outcome of normalizing one reasoning response: a draft ready for scoring, or a
 * terminal {@code PARSE_ERROR} record.
 */
public final class NormalizedAudit {

    private final AuditDraft draft;
    private final AuditRecord terminalRecord;

    private NormalizedAudit(AuditDraft draft, AuditRecord terminalRecord) {
        this.draft = draft;
        this.terminalRecord = terminalRecord;
    }

    public static NormalizedAudit parsed(AuditDraft draft) {
        return new NormalizedAudit(draft, null);
    }

    public static NormalizedAudit unparseable(String rawText) {
        return new NormalizedAudit(null, AuditRecord.parseError(rawText));
    }

    public boolean isParsed() {
        return draft != null;
    }

    public AuditDraft getDraft() {
        return draft;
    }

    public AuditRecord getTerminalRecord() {
        return terminalRecord;
    }
}
