package com.eainde.labaudit.workflow.nodes;

import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.Finding;
import com.eainde.labaudit.normalize.AuditDraft;
import com.eainde.labaudit.scoring.DeterministicScorer;
import com.eainde.labaudit.scoring.PhantomFindingFilter;
import com.eainde.labaudit.scoring.ScoreResult;
import com.eainde.labaudit.workflow.state.AuditState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Filters phantom findings and replaces the model's verdict with the deterministic score.
 */
@Slf4j
public class ScoreNode implements AsyncNodeAction<AuditState> {

    private final PhantomFindingFilter findingFilter;
    private final DeterministicScorer scorer;

    public ScoreNode(PhantomFindingFilter findingFilter, DeterministicScorer scorer) {
        this.findingFilter = findingFilter;
        this.scorer = scorer;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AuditState state) {
        AuditDraft draft = state.getDraft();
        List<Finding> findings = findingFilter.filter(draft.findings());
        ScoreResult result = scorer.score(draft.checklist(), findings);

        log.info("Scored audit: {} ({}) - checklist {}/{}/{} compliant/non-compliant/unable, "
                        + "{} of {} findings kept, penalty {}",
                result.score(), result.status(),
                result.tally().compliant(), result.tally().nonCompliant(), result.tally().unable(),
                findings.size(), draft.findings().size(), result.penalty());

        return CompletableFuture.completedFuture(Map.of(
                AuditState.RECORD, draft.toRecord(findings, result.score(), result.status()),
                AuditState.TRAIL, state.advance(AuditStage.SCORED)));
    }
}
