package com.vtb.triage.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Находка в "родном" формате сканера, до нормализации.
 * Живёт только в пределах одного запуска адаптера.
 */
@Value
@Builder
public class RawFinding {
    String tool;
    String ruleId;
    String message;
    String filePath;
    int line;
    Integer endLine;
    Integer column;
    String rawSeverity;
    
    // Необязательные поля, которые отдают не все инструменты
    String categoryHint;
    String snippet;
    String rawConfidence;
    @Singular
    List<String> references;
}
