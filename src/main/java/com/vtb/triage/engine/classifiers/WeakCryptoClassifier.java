package com.vtb.triage.engine.classifiers;

import com.vtb.triage.engine.FindingClassifier;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Слабая криптография (CWE-327, 328, 326, 916).
 * MD5/SHA-1 для контрольных сумм допустимы, для паролей и токенов - нет.
 */
public class WeakCryptoClassifier implements FindingClassifier {
    
    public static final String ID = "weak-crypto";
    private static final Set<String> CWES = Set.of("CWE-327", "CWE-328", "CWE-326", "CWE-916");
    
    private static final Map<String, String> WEAK_ALGORITHMS = new LinkedHashMap<>();
    
    static {
        WEAK_ALGORITHMS.put("md5", "MD5 криптографически сломан");
        WEAK_ALGORITHMS.put("sha1", "у SHA-1 известны коллизии");
        WEAK_ALGORITHMS.put("3des", "Triple DES устарел");
        WEAK_ALGORITHMS.put("des", "у DES недостаточная длина ключа (56 бит)");
        WEAK_ALGORITHMS.put("rc2", "RC2 считается слабым");
        WEAK_ALGORITHMS.put("rc4", "у RC4 известны смещения потока");
        WEAK_ALGORITHMS.put("blowfish", "64-битный блок Blowfish уязвим");
    }
    
    private static final List<String> SAFE_ALGORITHMS = List.of(
        "sha256", "sha384", "sha512", "sha3", "aes", "chacha20", "poly1305",
        "argon2", "bcrypt", "scrypt", "pbkdf2");
    
    private static final List<String> CHECKSUM_CONTEXT = List.of(
        "checksum", "file_hash", "hash_file", "etag", "integrity", "verify_file", "compare_hash");
    
    private static final List<String> SECURITY_CONTEXT = List.of(
        "password", "credential", "auth", "secret", "token", "key");
    
    private static final List<String> STRONG_SECURITY_CONTEXT = List.of(
        "password", "credential", "auth", "encrypt");
    
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
        
        for (Map.Entry<String, String> weak : WEAK_ALGORITHMS.entrySet()) {
            String algorithm = weak.getKey();
            if (!code.contains(algorithm)) {
                continue;
            }
            String name = algorithm.toUpperCase(Locale.ROOT);
            if (("md5".equals(algorithm) || "sha1".equals(algorithm)) && isChecksumContext(code, algorithm)) {
                return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.75,
                    name + " используется для контрольной суммы, а не для защиты");
            }
            if (Heuristics.firstMatch(code, STRONG_SECURITY_CONTEXT) != null) {
                return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.9,
                    "Слабый алгоритм " + name + " в контексте безопасности: " + weak.getValue());
            }
            return Heuristics.result(ID, Verdict.TRUE_POSITIVE, 0.85,
                "Слабый алгоритм " + name + ": " + weak.getValue());
        }
        
        String safe = Heuristics.firstMatch(code, SAFE_ALGORITHMS);
        if (safe != null) {
            return Heuristics.result(ID, Verdict.FALSE_POSITIVE, 0.7,
                "Используется стойкий алгоритм: " + safe);
        }
        
        return Heuristics.result(ID, Verdict.NEEDS_REVIEW, 0.5,
            "Не удалось определить используемый алгоритм");
    }
    
    /**
     * Алгоритм и признак контрольной суммы в одной строке, без признаков защиты секретов
     */
    static boolean isChecksumContext(String code, String algorithm) {
        for (String line : code.split("\\R")) {
            String stripped = line.strip();
            if (stripped.startsWith("#") || stripped.startsWith("//") || stripped.startsWith("*")) {
                continue;
            }
            if (!line.contains(algorithm)) {
                continue;
            }
            if (Heuristics.firstMatch(line, SECURITY_CONTEXT) != null) {
                return false;
            }
            if (Heuristics.firstMatch(line, CHECKSUM_CONTEXT) != null) {
                return true;
            }
            if (line.contains("file_" + algorithm) || line.contains(algorithm + "_file")) {
                return true;
            }
        }
        return false;
    }
}
