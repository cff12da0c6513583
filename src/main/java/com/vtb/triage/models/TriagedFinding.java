package com.vtb.triage.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Находка после триажа. Сама UnifiedFinding не заменяется,
 * результаты триажа прикладываются рядом с ней.
 */
@Value
@Builder
@Jacksonized
public class TriagedFinding {
    UnifiedFinding finding;
    Classification classification;
    RiskScore riskScore;
    @With
    String clusterId;
    Explanation explanation;
    
    @JsonIgnore
    public String getFingerprint() {
        return finding.getFingerprint();
    }
    
    @JsonIgnore
    public boolean isActionable() {
        return classification != null && classification.getVerdict() == Verdict.TRUE_POSITIVE;
    }
    
    @JsonIgnore
    public boolean requiresReview() {
        return classification != null && classification.getVerdict() == Verdict.NEEDS_REVIEW;
    }
}
