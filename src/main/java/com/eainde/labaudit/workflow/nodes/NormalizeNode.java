package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.normalize.AuditResponseNormalizer;
import com.eainde.labaudit.normalize.NormalizedAudit;
import com.eainde.labaudit.workflow.state.AuditState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class NormalizeNode implements AsyncNodeAction<AuditState> {

    private final AuditResponseNormalizer normalizer;

    public NormalizeNode(AuditResponseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        NormalizedAudit normalized = normalizer.normalize(state.getReasoningText());
        if (!normalized.isParsed()) {
            return CompletableFuture.completedFuture(Map.of(
                    AuditState.RECORD, normalized.getTerminalRecord(),
                    AuditState.TRAIL, state.advance(AuditStage.NORMALIZED)));
        }
        return CompletableFuture.completedFuture(Map.of(
                AuditState.DRAFT, normalized.getDraft(),
                AuditState.TRAIL, state.advance(AuditStage.NORMALIZED)));
    }
}
