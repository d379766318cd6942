package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.AuditStatus;

/**
 * @param score   final integrity score, 0..100
 * @param status  PASS, INVESTIGATE or FAIL
 * @param tally   checklist counts the score was computed from
 * @param raw     checklist score before penalties
 * @param penalty sum of severity weights of the scored findings
 */
public record ScoreResult(int score, AuditStatus status, ChecklistTally tally, double raw, int penalty) {}
