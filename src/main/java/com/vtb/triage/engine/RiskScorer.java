package com.vtb.triage.engine;

import com.vtb.triage.config.EngineConfig;
import com.vtb.triage.models.RiskScore;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.UnifiedFinding;

import java.util.Map;

/**
 * Risk = (Impact × Exploitability) / DetectionTime.
 * 
 * Все коэффициенты берутся из таблиц конфигурации (riskTables).
 * Impact и Exploitability ограничены диапазоном 1..10.
 */
public class RiskScorer {
    
    private static final double MIN_FACTOR = 1.0;
    private static final double MAX_FACTOR = 10.0;
    
    private final EngineConfig.RiskTables tables;
    
    public RiskScorer(EngineConfig.RiskTables tables) {
        this.tables = tables;
    }
    
    public RiskScore score(UnifiedFinding finding) {
        Severity severity = finding.getSeverity() != null ? finding.getSeverity() : Severity.INFO;
        String category = finding.getCategory();
        
        double impact = clamp(lookup(tables.getImpactBySeverity(), severity.name(), 1.0));
        
        Double byCategory = category != null ? tables.getExploitabilityByCategory().get(category) : null;
        double exploitability = clamp(byCategory != null
            ? byCategory
            : lookup(tables.getExploitabilityBySeverity(), severity.name(), 1.0));
        
        Double detection = category != null ? tables.getDetectionTimeByCategory().get(category) : null;
        double detectionTime = detection != null ? detection : tables.getDefaultDetectionTime();
        
        return RiskScore.of(impact, exploitability, detectionTime, tables.getDetectionTimeFloor());
    }
    
    private static double lookup(Map<String, Double> table, String key, double fallback) {
        Double value = table != null ? table.get(key) : null;
        return value != null ? value : fallback;
    }
    
    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return MIN_FACTOR;
        }
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, value));
    }
}
