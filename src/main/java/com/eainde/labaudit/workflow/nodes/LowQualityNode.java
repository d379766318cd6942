package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal verdict for images the quality gate rejected. The reasoning model is not called.
 */
@Slf4j
public class LowQualityNode implements AsyncNodeAction<AuditState> {

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        int quality = state.getObservation().imageQuality();
        log.info("Image quality {}/10 is below the audit threshold - skipping protocol comparison", quality);
        return CompletableFuture.completedFuture(Map.of(
                AuditState.RECORD, AuditRecord.insufficientQuality(quality),
                AuditState.TRAIL, state.advance(AuditStage.ABORTED_LOW_QUALITY)));
    }
}
