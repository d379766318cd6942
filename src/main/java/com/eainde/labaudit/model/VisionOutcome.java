package com.eainde.labaudit.model;

import java.io.Serializable;

/**
 * Result of the vision stage: either a description or the reason every model failed.
 */
public final class VisionOutcome implements Serializable {

    private final boolean success;
    private final String description;
    private final String failureReason;
    private final String modelName;

    private VisionOutcome(boolean success, String description, String failureReason, String modelName) {
        this.success = success;
        this.description = description;
        this.failureReason = failureReason;
        this.modelName = modelName;
    }

    public static VisionOutcome success(String description, String modelName) {
        return new VisionOutcome(true, description, null, modelName);
    }

    public static VisionOutcome failure(String failureReason) {
        return new VisionOutcome(false, null, failureReason, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDescription() {
        return description;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /** Model that produced the description; null for cached results and failures. */
    public String getModelName() {
        return modelName;
    }

    /**
     * Text handed to the reasoning stage. A failure is rendered as an error notice so the
     * comparison still receives a string and produces a low-signal audit.
     */
    public String textForReasoning() {
        if (success) {
            return description;
        }
        return "Vision analysis error: " + failureReason + ". All vision models unavailable.";
    }
}
