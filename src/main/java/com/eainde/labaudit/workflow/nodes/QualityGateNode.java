package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.classify.MismatchDetector;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.ExperimentCheck;
import com.eainde.labaudit.model.VisionObservation;
import com.eainde.labaudit.normalize.VisionResponseNormalizer;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the vision header markers and reconciles the experiment type with the protocol.
 * Routing on image quality is done by {@link com.eainde.labaudit.workflow.edges.QualityRoutingEdge}.
 */
@Slf4j
public class QualityGateNode implements AsyncNodeAction<AuditState> {

    private final VisionResponseNormalizer visionNormalizer;
    private final MismatchDetector mismatchDetector;

    public QualityGateNode(VisionResponseNormalizer visionNormalizer, MismatchDetector mismatchDetector) {
        this.visionNormalizer = visionNormalizer;
        this.mismatchDetector = mismatchDetector;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        VisionObservation observation = visionNormalizer.normalize(state.getVisionOutcome().textForReasoning());
        ExperimentCheck check = mismatchDetector.check(observation, state.getProtocolText());

        log.info("Vision observation: type={}, quality={}",
                observation.experimentType(),
                observation.imageQuality() == null ? "unknown" : observation.imageQuality());

        return CompletableFuture.completedFuture(Map.of(
                AuditState.OBSERVATION, observation,
                AuditState.EXPERIMENT_CHECK, check,
                AuditState.TRAIL, state.advance(AuditStage.QUALITY_GATE)));
    }
}
