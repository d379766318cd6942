package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.cache.AuditCache;
import com.eainde.labaudit.cache.CacheKeys;
import com.eainde.labaudit.inference.ProtocolComparisonClient;
import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.VisionOutcome;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Compares the vision description with the protocol, reusing the cached comparison for
 * the same image and protocol.
 *
 * <p>A transport failure becomes a terminal ERROR record. A comparison made from a failed
 * vision stage is returned but not cached.</p>
 */
@Slf4j
public class ReasoningNode implements AsyncNodeAction<AuditState> {

    private final AuditCache cache;
    private final ProtocolComparisonClient comparisonClient;

    public ReasoningNode(AuditCache cache, ProtocolComparisonClient comparisonClient) {
        this.cache = cache;
        this.comparisonClient = comparisonClient;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        String key = CacheKeys.auditKey(state.getImageBytes(), state.getProtocolText());

        Optional<String> cached = cache.get(key);
        if (cached.isPresent() && !cached.get().isBlank()) {
            log.info("Audit cache hit for {}", VisionNode.abbreviate(key));
            return CompletableFuture.completedFuture(Map.of(
                    AuditState.REASONING_TEXT, cached.get(),
                    AuditState.REASONING_CACHED, true,
                    AuditState.TRAIL, state.advance(AuditStage.REASONING_CACHED)));
        }

        log.info("Audit cache miss for {} - calling reasoning model", VisionNode.abbreviate(key));
        VisionOutcome vision = state.getVisionOutcome();
        String response;
        try {
            response = comparisonClient.compare(vision.textForReasoning(), state.getProtocolText());
        } catch (RuntimeException e) {
            log.error("Protocol comparison failed - returning ERROR record", e);
            return CompletableFuture.completedFuture(Map.of(
                    AuditState.RECORD, AuditRecord.error(String.valueOf(e.getMessage())),
                    AuditState.REASONING_CACHED, false,
                    AuditState.TRAIL, state.advance(AuditStage.REASONING_PENDING)));
        }

        String text = response == null ? "" : response;
        if (vision.isSuccess() && !text.isBlank()) {
            cache.put(key, text);
        } else if (!vision.isSuccess()) {
            log.warn("Not caching comparison made without a vision description");
        }
        return CompletableFuture.completedFuture(Map.of(
                AuditState.REASONING_TEXT, text,
                AuditState.REASONING_CACHED, false,
                AuditState.TRAIL, state.advance(AuditStage.REASONING_PENDING)));
    }
}
