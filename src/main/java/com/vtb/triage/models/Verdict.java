package com.vtb.triage.models;

/**
 * Вердикт триажа
 */
public enum Verdict {
    TRUE_POSITIVE,
    FALSE_POSITIVE,
    NEEDS_REVIEW
}
