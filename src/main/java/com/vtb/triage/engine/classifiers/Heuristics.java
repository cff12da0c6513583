package com.vtb.triage.engine.classifiers;

import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Общие утилиты эвристических классификаторов
 */
final class Heuristics {
    
    private Heuristics() {
    }
    
    /**
     * Код находки в нижнем регистре (пустая строка, если фрагмента нет)
     */
    static String code(UnifiedFinding finding) {
        if (finding.getLocation() == null || finding.getLocation().getSnippet() == null) {
            return "";
        }
        return finding.getLocation().getSnippet().toLowerCase(Locale.ROOT);
    }
    
    static String file(UnifiedFinding finding) {
        if (finding.getLocation() == null || finding.getLocation().getFile() == null) {
            return "";
        }
        return finding.getLocation().getFile().toLowerCase(Locale.ROOT);
    }
    
    static boolean inCategory(UnifiedFinding finding, Set<String> cwes) {
        return finding.getCategory() != null && cwes.contains(finding.getCategory());
    }
    
    /**
     * Первый паттерн, встречающийся в тексте, или null
     */
    static String firstMatch(String text, List<String> patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return pattern;
            }
        }
        return null;
    }
    
    static Classification result(String classifierId, Verdict verdict, double confidence, String reasoning) {
        return Classification.builder()
            .classifierId(classifierId)
            .verdict(verdict)
            .confidence(confidence)
            .reasoning(reasoning)
            .build();
    }
}
