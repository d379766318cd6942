package com.eainde.labaudit.workflow.edges;

import com.eainde.labaudit.model.VisionObservation;
import com.eainde.labaudit.workflow.state.AuditState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Routes to the low-quality verdict when the declared image quality is at or below the
 * threshold. An unknown quality always proceeds.
 */
public class QualityRoutingEdge implements AsyncEdgeAction<AuditState> {

    public static final String LOW_QUALITY = "low_quality";
    public static final String PROCEED = "proceed";
    public static final int DEFAULT_REJECT_AT_OR_BELOW = 3;

    private final int rejectAtOrBelow;

    public QualityRoutingEdge(int rejectAtOrBelow) {
        this.rejectAtOrBelow = rejectAtOrBelow;
    }

    @Override
    public CompletableFuture<String> apply(AuditState state) {
        VisionObservation observation = state.getObservation();
        boolean lowQuality = observation != null
                && observation.imageQuality() != null
                && observation.imageQuality() <= rejectAtOrBelow;
        return CompletableFuture.completedFuture(lowQuality ? LOW_QUALITY : PROCEED);
    }
}
