package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.List;
import java.util.Set;

/**
 * Инъекции команд ОС (CWE-78, CWE-77)
 */
public class CommandInjectionClassifier implements FindingClassifier {
    
    public static final String ID = "command-injection";
    private static final Set<String> CWES = Set.of("CWE-78", "CWE-77");
    
    private static final List<String> SHELL_SINKS = List.of(
        "os.system(", "os.popen(", "shell=true", "child_process.exec(", "runtime.getruntime().exec(",
        "shell_exec(", "passthru(", "popen(", "`");
    
    private static final List<String> TAINTED_ARGUMENT = List.of(
        "+ \"", "\" +", "' +", "+ '", "f\"", "f'", ".format(", "%(", "% (", "${");
    
    private static final List<String> SAFE = List.of(
        "shlex.quote", "shlex.split", "escapeshellarg", "shell=false", "processbuilder(");
    
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
        String sink = Heuristics.firstMatch(code, SHELL_SINKS);
        String tainted = Heuristics.firstMatch(code, TAINTED_ARGUMENT);
        String safe = Heuristics.firstMatch(code, SAFE);
        
        if (safe != null && tainted == null) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.7,
                "Аргументы команды экранируются или передаются списком (" + safe + ")");
        }
        if (sink != null && tainted != null) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.85,
                "Команда оболочки (" + sink + ") собирается из строки с подстановкой");
        }
        if (sink != null) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.7,
                "Вызов оболочки " + sink + ", аргументы не экранируются");
        }
        return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
            "Не удалось определить, как формируется команда");
    }
}
