package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Результат оркестрации: дедуплицированные находки и учёт по адаптерам
 */
@Value
@Builder
public class OrchestrationResult {
    
    @Builder.Default
    List<UnifiedFinding> findings = new ArrayList<>();
    
    @Builder.Default
    List<AdapterOutcome> outcomes = new ArrayList<>();
    
    @Builder.Default
    long durationMs = 0;
    
    public List<AdapterOutcome> getSucceeded() {
        return filter(AdapterStatus.SUCCEEDED);
    }
    
    public List<AdapterOutcome> getSkipped() {
        return filter(AdapterStatus.SKIPPED);
    }
    
    /**
     * Упавшие адаптеры, включая тайм-ауты
     */
    public List<AdapterOutcome> getFailed() {
        return outcomes.stream()
            .filter(o -> o.getStatus() == AdapterStatus.FAILED || o.getStatus() == AdapterStatus.TIMED_OUT)
            .collect(Collectors.toList());
    }
    
    public boolean isPartial() {
        return !getFailed().isEmpty() || !getSkipped().isEmpty();
    }
    
    private List<AdapterOutcome> filter(AdapterStatus status) {
        return outcomes.stream()
            .filter(o -> o.getStatus() == status)
            .collect(Collectors.toList());
    }
}
