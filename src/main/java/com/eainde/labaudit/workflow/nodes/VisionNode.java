package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.cache.AuditCache;
import com.eainde.labaudit.cache.CacheKeys;
import com.eainde.labaudit.inference.FallbackVisionAnalyzer;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.VisionOutcome;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Describes the image, reusing the cached description of byte-identical images.
 * Only successful descriptions are cached.
 */
@Slf4j
public class VisionNode implements AsyncNodeAction<AuditState> {

    private final AuditCache cache;
    private final FallbackVisionAnalyzer analyzer;

    public VisionNode(AuditCache cache, FallbackVisionAnalyzer analyzer) {
        this.cache = cache;
        this.analyzer = analyzer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        String key = CacheKeys.visionKey(state.getImageBytes());

        Optional<String> cached = cache.get(key);
        if (cached.isPresent() && !cached.get().isBlank()) {
            log.info("Vision cache hit for {}", abbreviate(key));
            return CompletableFuture.completedFuture(Map.of(
                    AuditState.VISION_OUTCOME, VisionOutcome.success(cached.get(), null),
                    AuditState.VISION_CACHED, true,
                    AuditState.TRAIL, state.advance(AuditStage.VISION_CACHED)));
        }

        log.info("Vision cache miss for {} - calling vision models", abbreviate(key));
        VisionOutcome outcome = analyzer.analyze(state.getImageBytes(), state.getMimeType());
        if (outcome.isSuccess()) {
            cache.put(key, outcome.getDescription());
        }
        return CompletableFuture.completedFuture(Map.of(
                AuditState.VISION_OUTCOME, outcome,
                AuditState.VISION_CACHED, false,
                AuditState.TRAIL, state.advance(AuditStage.VISION_PENDING)));
    }

    static String abbreviate(String key) {
        return key.length() > 20 ? key.substring(0, 20) + "..." : key;
    }
}
