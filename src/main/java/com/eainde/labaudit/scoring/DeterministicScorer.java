package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.AuditStatus;
import com.eainde.labaudit.model.ChecklistItem;
import com.eainde.labaudit.model.Finding;

import java.util.List;

/**
 * Computes the integrity score purely from checklist tallies and findings.
 *
 * <pre>
 * raw     = total == 0 ? neutral : (compliant + unable * unableCredit) / total * 100
 * penalty = sum(weight(finding.severity))
 * score   = clamp(round(raw - penalty), 0, 100)
 * </pre>
 *
 * Any score the reasoning model proposed plays no part. Findings are expected to have
 * passed {@link PhantomFindingFilter} already.
 */
public class DeterministicScorer {

    private final ScoringPolicy policy;

    public DeterministicScorer(ScoringPolicy policy) {
        this.policy = policy;
    }

    public ScoreResult score(List<ChecklistItem> checklist, List<Finding> findings) {
        ChecklistTally tally = ChecklistTally.of(checklist == null ? List.of() : checklist);

        double raw;
        if (tally.total() == 0) {
            raw = policy.neutralScore();
        } else {
            raw = (tally.compliant() + tally.unable() * policy.unableCredit()) / tally.total() * 100.0;
        }

        int penalty = 0;
        if (findings != null) {
            for (Finding finding : findings) {
                penalty += policy.weightOf(finding.severity());
            }
        }

        int score = (int) Math.max(0, Math.min(100, Math.round(raw - penalty)));
        return new ScoreResult(score, statusFor(score), tally, raw, penalty);
    }

    public AuditStatus statusFor(int score) {
        if (score >= policy.passThreshold()) {
            return AuditStatus.PASS;
        }
        if (score >= policy.investigateThreshold()) {
            return AuditStatus.INVESTIGATE;
        }
        return AuditStatus.FAIL;
    }

    public ScoringPolicy getPolicy() {
        return policy;
    }
}
