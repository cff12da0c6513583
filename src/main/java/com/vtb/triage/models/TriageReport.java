package com.vtb.triage.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Итоговый набор для внешних потребителей (отчёты, генерация исправлений)
 * и формат сохраняемого снимка.
 */
@Value
@Builder
@Jacksonized
public class TriageReport {
    
    public static final int CURRENT_SNAPSHOT_VERSION = 1;
    
    @Builder.Default
    int snapshotVersion = CURRENT_SNAPSHOT_VERSION;
    
    Instant generatedAt;
    String target;
    
    @Builder.Default
    List<TriagedFinding> findings = new ArrayList<>();
    
    @Builder.Default
    List<Cluster> clusters = new ArrayList<>();
    
    @Builder.Default
    List<AdapterOutcome> adapterOutcomes = new ArrayList<>();
    
    /**
     * Находки для генерации исправлений: только TRUE_POSITIVE, передаются по ссылке
     */
    @JsonIgnore
    public List<TriagedFinding> actionableFindings() {
        return findings.stream()
            .filter(TriagedFinding::isActionable)
            .collect(Collectors.toList());
    }
    
    @JsonIgnore
    public List<UnifiedFinding> unifiedFindings() {
        return findings.stream()
            .map(TriagedFinding::getFinding)
            .collect(Collectors.toList());
    }
}
