package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Захардкоженные секреты (CWE-798, 259, 321, 522).
 * 
 * Порядок проверок: заглушки, энтропия Шеннона, тестовый контекст файла.
 * Высокая энтропия в продуктивном коде считается настоящим секретом.
 */
public class HardcodedSecretsClassifier implements FindingClassifier {
    
    public static final String ID = "hardcoded-secrets";
    private static final Set<String> CWES = Set.of("CWE-798", "CWE-259", "CWE-321", "CWE-522");
    
    static final double ENTROPY_THRESHOLD = 3.5;
    
    private static final List<Pattern> DUMMY_PATTERNS = List.of(
        Pattern.compile("^xxx+$"),
        Pattern.compile("^test"),
        Pattern.compile("^demo"),
        Pattern.compile("^example"),
        Pattern.compile("^placeholder"),
        Pattern.compile("^dummy"),
        Pattern.compile("^fake"),
        Pattern.compile("^changeme"),
        Pattern.compile("^password123?$"),
        Pattern.compile("^admin$"),
        Pattern.compile("^secret$"),
        Pattern.compile("^\\*+$"),
        Pattern.compile("^your[-_]"),
        Pattern.compile("^<.*>$"),
        Pattern.compile("^\\$\\{.*\\}$")
    );
    
    private static final String SECRET_NAMES =
        "(?:key|secret|token|password|pwd|pass|api[_-]?key|access[_-]?key|auth[_-]?token|credentials?)";
    
    private static final List<Pattern> EXTRACTORS = List.of(
        // KEY = "value"
        Pattern.compile("(?i)\\b" + SECRET_NAMES + "\\b\\s*[=:]\\s*[\"']([^\"']+)[\"']"),
        // "key": "value"
        Pattern.compile("(?i)[\"']" + SECRET_NAMES + "[\"']\\s*:\\s*[\"']([^\"']+)[\"']"),
        // любая строка от 8 символов
        Pattern.compile("[\"']([^\"']{8,})[\"']")
    );
    
    private static final List<String> TEST_CONTEXT = List.of("test", "mock", "fixture", "example");
    
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
        String code = finding.getLocation() != null ? finding.getLocation().getSnippet() : null;
        String secret = extractSecret(code);
        if (secret == null) {
            return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
                "Не удалось извлечь значение секрета из кода");
        }
        
        String lower = secret.toLowerCase(Locale.ROOT);
        for (Pattern dummy : DUMMY_PATTERNS) {
            if (dummy.matcher(lower).find()) {
                return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.85,
                    "Значение похоже на заглушку (" + dummy.pattern() + ")");
            }
        }
        
        double entropy = entropy(secret);
        if (entropy < ENTROPY_THRESHOLD) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.7,
                String.format(Locale.ROOT, "Низкая энтропия (%.2f бит/символ), вряд ли настоящий секрет", entropy));
        }
        
        String file = Heuristics.file(finding);
        if (Heuristics.firstMatch(file, TEST_CONTEXT) != null) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.8,
                "Секрет в тестовом или демонстрационном файле");
        }
        
        return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.8,
            String.format(Locale.ROOT, "Секрет с высокой энтропией (%.2f бит/символ) в продуктивном коде", entropy));
    }
    
    static String extractSecret(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (Pattern extractor : EXTRACTORS) {
            Matcher matcher = extractor.matcher(code);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
    
    /**
     * Энтропия Шеннона, бит на символ
     */
    static double entropy(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        value.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));
        double length = value.codePointCount(0, value.length());
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
