package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.List;
import java.util.Set;

/**
 * Path traversal (CWE-22, 23, 36, 73)
 */
public class PathTraversalClassifier implements FindingClassifier {
    
    public static final String ID = "path-traversal";
    private static final Set<String> CWES = Set.of("CWE-22", "CWE-23", "CWE-36", "CWE-73");
    
    private static final List<String> VALIDATION = List.of(
        "realpath", "abspath", "normpath", "resolve()", ".startswith(", "is_relative_to",
        "secure_filename", "path.join", "normalize()", "getcanonicalpath");
    
    private static final List<String> FILE_OPERATIONS = List.of(
        "open(", "read(", "readfile", "file_get_contents", "include(", "require(",
        "send_file", "sendfile", "new file(", "files.read");
    
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
        boolean validated = Heuristics.firstMatch(code, VALIDATION) != null;
        String operation = Heuristics.firstMatch(code, FILE_OPERATIONS);
        
        if (validated && operation != null) {
            return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.6,
                "Файловая операция с частичной проверкой пути, нужно убедиться, что проверка идёт до доступа");
        }
        if (validated) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.7,
                "Путь проверяется, вероятно безопасно");
        }
        if (operation != null) {
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.7,
                "Файловая операция " + operation + " без видимой проверки пути");
        }
        return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
            "Не удалось определить, проверяется ли путь");
    }
}
