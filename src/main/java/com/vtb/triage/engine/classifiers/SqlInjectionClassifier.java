package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.List;
import java.util.Set;

/**
 * SQL-инъекции (CWE-89, CWE-564).
 * Конкатенация в запросе важнее признаков параметризации: "?" рядом с "+" не спасает.
 */
public class SqlInjectionClassifier implements FindingClassifier {
    
    public static final String ID = "sql-injection";
    private static final Set<String> CWES = Set.of("CWE-89", "CWE-564");
    
    private static final List<String> CONCATENATION = List.of(
        "+ \"", "\" +", "' +", "+ '", "\" %", "' %", "f\"", "f'", ".format(", "% (", "%(", "${", "+=");
    
    private static final List<String> PARAMETERIZED = List.of(
        "?", "$1", "$2", ":param", "%s\",", "%s',", "preparestatement", "prepared", "bindparam", "setstring(", "setint(");
    
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
        
        String concat = Heuristics.firstMatch(code, CONCATENATION);
        if (concat != null) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.8,
                "Запрос собирается конкатенацией (" + concat + "), вероятна SQL-инъекция");
        }
        
        String parameterized = Heuristics.firstMatch(code, PARAMETERIZED);
        if (parameterized != null) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.7,
                "Параметризованный запрос (" + parameterized + "), построение запроса безопасно");
        }
        
        return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
            "Не удалось определить, как строится запрос");
    }
}
