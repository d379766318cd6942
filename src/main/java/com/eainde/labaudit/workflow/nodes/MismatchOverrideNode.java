package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.classify.MismatchDetector;
import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.ExperimentCheck;
import com.eainde.labaudit.workflow.state.AuditState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Clamps the scored record when the image does not match the protocol. Always runs after
 * {@link ScoreNode}.
 */
public class MismatchOverrideNode implements AsyncNodeAction<AuditState> {

    private final MismatchDetector mismatchDetector;

    public MismatchOverrideNode(MismatchDetector mismatchDetector) {
        this.mismatchDetector = mismatchDetector;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        ExperimentCheck check = state.getExperimentCheck();
        if (!check.mismatch()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        AuditRecord overridden = mismatchDetector.applyOverride(state.getRecord(), check);
        return CompletableFuture.completedFuture(Map.of(
                AuditState.RECORD, overridden,
                AuditState.TRAIL, state.advance(AuditStage.MISMATCH_OVERRIDDEN)));
    }
}
