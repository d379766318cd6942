package com.eainde.labaudit.model;

/**
 * Overall verdict of an audit.
 *
 * <p>PASS, INVESTIGATE and FAIL are always derived from the engine-computed score.
 * The remaining values are terminal outcomes that carry no numeric verdict
 * (ERROR carries a fixed score of 0).</p>
 */
public enum AuditStatus {
    PASS,
    INVESTIGATE,
    FAIL,
    ERROR,
    PARSE_ERROR,
    INSUFFICIENT_QUALITY
}
