package com.vtb.triage.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Оценка риска: (Impact × Exploitability) / DetectionTime
 */
@Value
@Builder
@Jacksonized
public class RiskScore {
    private static final double MIN_VALUE = 0.01;
    
    double impact;
    double exploitability;
    double detectionTime;
    /** Точное значение, по нему идёт сортировка */
    double value;
    
    /**
     * Посчитать оценку. DetectionTime ограничивается снизу floor (и всегда > 0).
     */
    public static RiskScore of(double impact, double exploitability, double detectionTime, double floor) {
        double safeFloor = floor > 0 && Double.isFinite(floor) ? floor : 1.0;
        double effectiveTime = Double.isFinite(detectionTime) ? Math.max(detectionTime, safeFloor) : safeFloor;
        double raw = (impact * exploitability) / effectiveTime;
        if (!Double.isFinite(raw) || raw <= 0) {
            raw = MIN_VALUE;
        }
        return RiskScore.builder()
            .impact(impact)
            .exploitability(exploitability)
            .detectionTime(effectiveTime)
            .value(raw)
            .build();
    }
    
    /**
     * Значение для отображения, округлено до сотых
     */
    @JsonIgnore
    public double getDisplayValue() {
        return Math.max(Math.round(value * 100.0) / 100.0, MIN_VALUE);
    }
}
