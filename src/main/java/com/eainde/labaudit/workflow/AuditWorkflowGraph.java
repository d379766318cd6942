package com.eainde.labaudit.workflow;

import com.eainde.labaudit.workflow.edges.QualityRoutingEdge;
import com.eainde.labaudit.workflow.edges.TerminalRecordEdge;
import com.eainde.labaudit.workflow.nodes.LowQualityNode;
import com.eainde.labaudit.workflow.nodes.MismatchOverrideNode;
import com.eainde.labaudit.workflow.nodes.NormalizeNode;
import com.eainde.labaudit.workflow.nodes.QualityGateNode;
import com.eainde.labaudit.workflow.nodes.ReasoningNode;
import com.eainde.labaudit.workflow.nodes.ScoreNode;
import com.eainde.labaudit.workflow.nodes.VisionNode;
import com.eainde.labaudit.workflow.state.AuditState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the audit stages into a graph:
 * <pre>
 * vision -> quality_gate -(low)-> reject_low_quality -> END
 *                        -(ok)--> reasoning -(terminal)-> END
 *                                           -(continue)-> normalize -(terminal)-> END
 *                                                                   -(continue)-> score -> mismatch_override -> END
 * </pre>
 */
public class AuditWorkflowGraph {

    static final String VISION = "vision";
    static final String QUALITY_GATE = "quality_gate";
    static final String REJECT_LOW_QUALITY = "reject_low_quality";
    static final String REASONING = "reasoning";
    static final String NORMALIZE = "normalize";
    static final String SCORE = "score";
    static final String MISMATCH_OVERRIDE = "mismatch_override";

    private final VisionNode visionNode;
    private final QualityGateNode qualityGateNode;
    private final LowQualityNode lowQualityNode;
    private final ReasoningNode reasoningNode;
    private final NormalizeNode normalizeNode;
    private final ScoreNode scoreNode;
    private final MismatchOverrideNode mismatchOverrideNode;
    private final QualityRoutingEdge qualityRoutingEdge;
    private final TerminalRecordEdge terminalRecordEdge;

    public AuditWorkflowGraph(
            VisionNode visionNode,
            QualityGateNode qualityGateNode,
            LowQualityNode lowQualityNode,
            ReasoningNode reasoningNode,
            NormalizeNode normalizeNode,
            ScoreNode scoreNode,
            MismatchOverrideNode mismatchOverrideNode,
            QualityRoutingEdge qualityRoutingEdge,
            TerminalRecordEdge terminalRecordEdge) {
        this.visionNode = visionNode;
        this.qualityGateNode = qualityGateNode;
        this.lowQualityNode = lowQualityNode;
        this.reasoningNode = reasoningNode;
        this.normalizeNode = normalizeNode;
        this.scoreNode = scoreNode;
        this.mismatchOverrideNode = mismatchOverrideNode;
        this.qualityRoutingEdge = qualityRoutingEdge;
        this.terminalRecordEdge = terminalRecordEdge;
    }

    public CompiledGraph<AuditState> build() throws GraphStateException {
        StateGraph<AuditState> workflow = new StateGraph<>(AuditState::new);

        workflow.addNode(VISION, visionNode);
        workflow.addNode(QUALITY_GATE, qualityGateNode);
        workflow.addNode(REJECT_LOW_QUALITY, lowQualityNode);
        workflow.addNode(REASONING, reasoningNode);
        workflow.addNode(NORMALIZE, normalizeNode);
        workflow.addNode(SCORE, scoreNode);
        workflow.addNode(MISMATCH_OVERRIDE, mismatchOverrideNode);

        workflow.addEdge(START, VISION);
        workflow.addEdge(VISION, QUALITY_GATE);

        workflow.addConditionalEdges(
                QUALITY_GATE,
                qualityRoutingEdge,
                Map.of(
                        QualityRoutingEdge.LOW_QUALITY, REJECT_LOW_QUALITY,
                        QualityRoutingEdge.PROCEED, REASONING
                )
        );
        workflow.addEdge(REJECT_LOW_QUALITY, END);

        workflow.addConditionalEdges(
                REASONING,
                terminalRecordEdge,
                Map.of(
                        TerminalRecordEdge.TERMINAL, END,
                        TerminalRecordEdge.CONTINUE, NORMALIZE
                )
        );
        workflow.addConditionalEdges(
                NORMALIZE,
                terminalRecordEdge,
                Map.of(
                        TerminalRecordEdge.TERMINAL, END,
                        TerminalRecordEdge.CONTINUE, SCORE
                )
        );

        workflow.addEdge(SCORE, MISMATCH_OVERRIDE);
        workflow.addEdge(MISMATCH_OVERRIDE, END);

        return workflow.compile();
    }
}
