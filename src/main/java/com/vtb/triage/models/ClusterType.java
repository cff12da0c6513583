package com.vtb.triage.models;

/**
 * Стратегия, по которой собран кластер
 */
public enum ClusterType {
    /** Одна категория в одном файле */
    CATEGORY_FILE,
    /** Одна категория и общий структурный паттерн (например, одна и та же функция-хелпер) */
    PATTERN
}
