package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.List;
import java.util.Set;

/**
 * XSS (CWE-79, CWE-80): экранирование вывода против опасных DOM-стоков
 */
public class XssClassifier implements FindingClassifier {
    
    public static final String ID = "xss";
    private static final Set<String> CWES = Set.of("CWE-79", "CWE-80");
    
    private static final List<String> SAFE = List.of(
        "escape(", "htmlescape", "html.escape", "sanitize", "encode(", "encodeuri",
        "textcontent", "innertext", "createtextnode");
    
    private static final List<String> DANGEROUS = List.of(
        "innerhtml", "outerhtml", "document.write", "eval(", "v-html",
        "dangerouslysetinnerhtml", "[innerhtml]", "|safe", "mark_safe(", "markup(");
    
    @Override
    public String id() {
        return ID;
    }
    
    @Override
    public boolean supports(UnifiedFinding finding) {
        return Heuristics.inCategory(finding, CWES);
    }
    
    @Override
    public Classification classify(UnifiedFinding finding) {
        String code = Heuristics.code(finding);
        
        String safe = Heuristics.firstMatch(code, SAFE);
        if (safe != null) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.75,
                "Вывод экранируется (" + safe + ")");
        }
        
        String sink = Heuristics.firstMatch(code, DANGEROUS);
        if (sink != null) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.8,
                "Опасный сток " + sink + " без видимой санитизации");
        }
        
        return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
            "Не удалось определить, экранируется ли вывод");
    }
}
