package com.eainde.labaudit.workflow.state;

import com.eainde.labaudit.model.AuditRecord;
import com.eainde.labaudit.model.AuditStage;
import com.eainde.labaudit.model.ExperimentCheck;
import com.eainde.labaudit.model.VisionObservation;
import com.eainde.labaudit.model.VisionOutcome;
import com.eainde.labaudit.normalize.AuditDraft;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph state of one audit run. Every value stored here is {@link java.io.Serializable}.
 */
public class AuditState extends AgentState {

    // Input
    public static final String IMAGE = "imageBytes";
    public static final String MIME_TYPE = "mimeType";
    public static final String PROTOCOL = "protocolText";

    // Vision stage
    public static final String VISION_OUTCOME = "visionOutcome";
    public static final String VISION_CACHED = "visionCached";

    // Quality gate
    public static final String OBSERVATION = "observation";
    public static final String EXPERIMENT_CHECK = "experimentCheck";

    // Reasoning and scoring
    public static final String REASONING_TEXT = "reasoningText";
    public static final String REASONING_CACHED = "reasoningCached";
    public static final String DRAFT = "draft";
    public static final String RECORD = "record";

    public static final String TRAIL = "trail";

    public AuditState(Map<String, Object> initData) {
        super(initData);
    }

    public static Map<String, Object> inputs(byte[] imageBytes, String mimeType, String protocolText) {
        return Map.of(
                IMAGE, imageBytes,
                MIME_TYPE, mimeType,
                PROTOCOL, protocolText,
                TRAIL, new ArrayList<>(List.of(AuditStage.UPLOADED)));
    }

    public byte[] getImageBytes() {
        return (byte[]) data().get(IMAGE);
    }

    public String getMimeType() {
        return (String) data().get(MIME_TYPE);
    }

    public String getProtocolText() {
        return (String) data().get(PROTOCOL);
    }

    public VisionOutcome getVisionOutcome() {
        return (VisionOutcome) data().get(VISION_OUTCOME);
    }

    public boolean isVisionCached() {
        return Boolean.TRUE.equals(data().get(VISION_CACHED));
    }

    public VisionObservation getObservation() {
        return (VisionObservation) data().get(OBSERVATION);
    }

    public ExperimentCheck getExperimentCheck() {
        ExperimentCheck check = (ExperimentCheck) data().get(EXPERIMENT_CHECK);
        return check != null ? check : ExperimentCheck.none();
    }

    public String getReasoningText() {
        return (String) data().get(REASONING_TEXT);
    }

    public boolean isReasoningCached() {
        return Boolean.TRUE.equals(data().get(REASONING_CACHED));
    }

    public AuditDraft getDraft() {
        return (AuditDraft) data().get(DRAFT);
    }

    public AuditRecord getRecord() {
        return (AuditRecord) data().get(RECORD);
    }

    public boolean hasRecord() {
        return data().get(RECORD) != null;
    }

    @SuppressWarnings("unchecked")
    public List<AuditStage> getTrail() {
        List<AuditStage> trail = (List<AuditStage>) data().get(TRAIL);
        return trail != null ? trail : List.of();
    }

    /** Trail extended by one stage, for a node's state update. */
    public ArrayList<AuditStage> advance(AuditStage... stages) {
        ArrayList<AuditStage> trail = new ArrayList<>(getTrail());
        trail.addAll(List.of(stages));
        return trail;
    }
}
