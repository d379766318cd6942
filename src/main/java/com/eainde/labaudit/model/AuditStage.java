package com.eainde.labaudit.model;

/**
 * States of the audit pipeline, in the order a full run passes through them.
 */
public enum AuditStage {
    UPLOADED,
    VISION_PENDING,
    VISION_CACHED,
    QUALITY_GATE,
    ABORTED_LOW_QUALITY,
    REASONING_PENDING,
    REASONING_CACHED,
    NORMALIZED,
    SCORED,
    MISMATCH_OVERRIDDEN,
    COMPLETE
}
