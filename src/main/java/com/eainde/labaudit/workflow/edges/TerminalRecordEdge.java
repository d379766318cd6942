package com.eainde.labaudit.workflow.edges;

import com.eainde.labaudit.workflow.state.AuditState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.concurrent.CompletableFuture;

/**
 * Ends the run as soon as a stage has produced a terminal record (ERROR, PARSE_ERROR).
 */
public class TerminalRecordEdge implements AsyncEdgeAction<AuditState> {

    public static final String TERMINAL = "terminal";
    public static final String CONTINUE = "continue";

    @Override
    public CompletableFuture<String> apply(AuditState state) {
        return CompletableFuture.completedFuture(state.hasRecord() ? TERMINAL : CONTINUE);
    }
}
