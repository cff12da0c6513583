package com.vtb.triage.models;

import java.util.Locale;

/**
 * Уверенность отдельного сканера в своей находке
 */
public enum Confidence {
    HIGH(3),
    MEDIUM(2),
    LOW(1);
    
    private final int rank;
    
    Confidence(int rank) {
        this.rank = rank;
    }
    
    public int getRank() {
        return rank;
    }
    
    /**
     * Неизвестные и пустые значения считаются MEDIUM.
     */
    public static Confidence fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "HIGH", "CERTAIN", "FIRM" -> HIGH;
            case "LOW", "TENTATIVE" -> LOW;
            default -> MEDIUM;
        };
    }
}
