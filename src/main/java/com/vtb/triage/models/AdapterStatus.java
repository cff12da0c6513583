package com.vtb.triage.models;

/**
 * Итог запуска одного адаптера
 */
public enum AdapterStatus {
    SUCCEEDED,
    SKIPPED,
    FAILED,
    TIMED_OUT
}
