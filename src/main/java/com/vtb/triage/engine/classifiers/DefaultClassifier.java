package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

/**
 * Базовый классификатор для всех категорий.
 * Подтверждение двумя и более разными инструментами переводит HIGH/CRITICAL в TRUE_POSITIVE.
 */
public class DefaultClassifier implements FindingClassifier {
    
    public static final String ID = "default";
    
    @Override
    public String id() {
        return ID;
    }
    
    @Override
    public boolean supports(UnifiedFinding finding) {
        return true;
    }
    
    @Override
    public Classification classify(UnifiedFinding finding) {
        Severity severity = finding.getSeverity() != null ? finding.getSeverity() : Severity.INFO;
        long tools = finding.distinctToolCount();
        
        if (tools >= 2 && severity.isAtLeast(Severity.HIGH)) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.75,
                "Находку " + severity + " независимо подтвердили " + tools + " инструмента");
        }
        
        return switch (severity) {
            case CRITICAL, HIGH -> Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.6,
                "Высокая критичность (" + severity + "), требуется проверка");
            case LOW, INFO -> Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.4,
                "Низкая критичность (" + severity + "), возможно ложное срабатывание");
            default -> Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
                "Средняя критичность, требуется ручная проверка");
        };
    }
}
