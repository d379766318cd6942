package com.eainde.labaudit.workflow;

import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditResult;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.VisionOutcome;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for auditing one image against one protocol.
 * <p>
 * Validates the upload, runs the audit graph under a fresh thread id and folds the final
 * state into an {@link AuditResult}. Every failure, including unexpected ones inside the
 * graph, is reported as an ERROR record.
 * </p>
 */
@Slf4j
public class AuditOrchestrator {

    static final String DEFAULT_MIME_TYPE = "image/jpeg";

    private final CompiledGraph<AuditState> graph;

    public AuditOrchestrator(CompiledGraph<AuditState> graph) {
        this.graph = graph;
    }

    /**
     * Audits an image against a protocol. Never throws.
     *
     * @param imageBytes   raw uploaded image
     * @param mimeType     image MIME type, defaults to {@code image/jpeg} when blank
     * @param protocolText SOP text the image is compared against
     * @return the audit result; its record is never null
     */
    public AuditResult audit(byte[] imageBytes, String mimeType, String protocolText) {
        if (imageBytes == null || imageBytes.length == 0) {
            log.warn("Rejecting audit request without image bytes");
            return AuditResult.failed(AuditRecord.error("no image provided"));
        }
        if (protocolText == null || protocolText.isBlank()) {
            log.warn("Rejecting audit request without protocol text");
            return AuditResult.failed(AuditRecord.error("no protocol text provided"));
        }
        String mime = mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;

        String runId = UUID.randomUUID().toString();
        log.info("{} starting audit: {} bytes, {} protocol chars", runId, imageBytes.length, protocolText.length());

        RunnableConfig config = RunnableConfig.builder()
                .threadId(runId)
                .build();

        Optional<AuditState> finalState;
        try {
            finalState = graph.invoke(AuditState.inputs(imageBytes, mime, protocolText), config);
        } catch (Exception e) {
            log.error("{} audit graph failed", runId, e);
            return AuditResult.failed(AuditRecord.error(String.valueOf(e.getMessage())));
        }

        if (finalState.isEmpty() || !finalState.get().hasRecord()) {
            log.error("{} audit graph finished without a record", runId);
            return AuditResult.failed(AuditRecord.error("audit pipeline produced no result"));
        }

        AuditResult result = toResult(finalState.get());
        log.info("{} audit complete: status={}, score={}", runId, result.record().status(), result.record().score());
        return result;
    }

    private static AuditResult toResult(AuditState state) {
        List<AuditStage> trail = new ArrayList<>(state.getTrail());
        trail.add(AuditStage.COMPLETE);
        VisionOutcome vision = state.getVisionOutcome();
        return new AuditResult(
                state.getRecord(),
                trail,
                vision == null ? null : vision.textForReasoning(),
                state.getReasoningText(),
                state.getExperimentCheck(),
                state.isVisionCached(),
                state.isReasoningCached());
    }
}
