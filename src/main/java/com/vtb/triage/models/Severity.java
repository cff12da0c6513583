package com.vtb.triage.models;

import java.util.Locale;

/**
 * Уровни критичности находок (нормализованная шкала UFF)
 */
public enum Severity {
    CRITICAL("Критический", 5),
    HIGH("Высокий", 4),
    MEDIUM("Средний", 3),
    LOW("Низкий", 2),
    INFO("Информационный", 1);
    
    private final String russianName;
    private final int priority;
    
    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public boolean isAtLeast(Severity floor) {
        return floor == null || this.priority >= floor.priority;
    }
    
    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.priority >= b.priority ? a : b;
    }
    
    /**
     * Нормализовать "сырую" критичность сканера.
     * Semgrep: ERROR/WARNING/INFO, Bandit: HIGH/MEDIUM/LOW, SARIF: error/warning/note.
     * Неизвестные значения трактуются как INFO.
     */
    public static Severity fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL", "BLOCKER" -> CRITICAL;
            case "HIGH", "ERROR", "MAJOR" -> HIGH;
            case "MEDIUM", "WARNING", "MODERATE" -> MEDIUM;
            case "LOW", "NOTE", "MINOR" -> LOW;
            default -> INFO;
        };
    }
    
    /**
     * Строгий разбор (для порога в конфигурации).
     *
     * @throws IllegalArgumentException если значение не является уровнем критичности
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Пустой уровень критичности");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
