package com.vtb.triage.engine;

import com.vtb.triage.models.Cluster;
import com.vtb.triage.models.ClusterType;
import com.vtb.triage.models.TriagedFinding;
import com.vtb.triage.models.UnifiedFinding;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Кластеризация по общей первопричине. Выполняется после триажа всего набора.
 * 
 * Сначала паттерны (одна категория и один и тот же вызов функции-хелпера),
 * затем категория + файл для оставшихся находок. Находка попадает максимум в один кластер.
 */
@Slf4j
public class FindingClusterer {
    
    // Вызов без квалификатора: build_query(...), но не cursor.execute(...)
    private static final Pattern BARE_CALL = Pattern.compile("(?<![\\w.$])([A-Za-z_][\\w$]*)\\s*\\(");
    
    private static final Set<String> IGNORED_CALLS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "function", "def", "new", "with", "elif",
        "print", "str", "int", "len", "open", "format", "list", "dict", "set", "tuple", "super", "require",
        "eval", "exec", "echo", "include", "typeof", "assert");
    
    private final int minPatternClusterSize;
    private final int minFileClusterSize;
    
    /**
     * Итог кластеризации
     */
    public record Result(List<TriagedFinding> findings, List<Cluster> clusters) {
    }
    
    public FindingClusterer(int minPatternClusterSize, int minFileClusterSize) {
        this.minPatternClusterSize = Math.max(2, minPatternClusterSize);
        this.minFileClusterSize = Math.max(2, minFileClusterSize);
    }
    
    public Result cluster(List<TriagedFinding> triaged) {
        Map<String, String> assignment = new HashMap<>();
        List<Cluster> clusters = new ArrayList<>();
        
        // 1. Паттерны: ключ "категория|функция"
        Map<String, SortedSet<String>> byPattern = new TreeMap<>();
        for (TriagedFinding finding : triaged) {
            String helper = helperCall(finding.getFinding());
            if (helper != null) {
                byPattern.computeIfAbsent(finding.getFinding().getCategory() + "|" + helper, k -> new TreeSet<>())
                    .add(finding.getFingerprint());
            }
        }
        for (Map.Entry<String, SortedSet<String>> entry : byPattern.entrySet()) {
            if (entry.getValue().size() >= minPatternClusterSize) {
                clusters.add(register(ClusterType.PATTERN, entry.getKey(), entry.getValue(), assignment));
            }
        }
        
        // 2. Категория + файл для ещё не сгруппированных
        Map<String, SortedSet<String>> byFile = new TreeMap<>();
        for (TriagedFinding finding : triaged) {
            if (assignment.containsKey(finding.getFingerprint())) {
                continue;
            }
            UnifiedFinding unified = finding.getFinding();
            String file = unified.getLocation() != null ? unified.getLocation().getFile() : "";
            byFile.computeIfAbsent(unified.getCategory() + "|" + file, k -> new TreeSet<>())
                .add(finding.getFingerprint());
        }
        for (Map.Entry<String, SortedSet<String>> entry : byFile.entrySet()) {
            if (entry.getValue().size() >= minFileClusterSize) {
                clusters.add(register(ClusterType.CATEGORY_FILE, entry.getKey(), entry.getValue(), assignment));
            }
        }
        
        List<TriagedFinding> result = new ArrayList<>(triaged.size());
        for (TriagedFinding finding : triaged) {
            result.add(finding.withClusterId(assignment.get(finding.getFingerprint())));
        }
        log.debug("Кластеров: {}, сгруппировано находок: {}", clusters.size(), assignment.size());
        return new Result(result, clusters);
    }
    
    private static Cluster register(ClusterType type, String key, SortedSet<String> members,
                                    Map<String, String> assignment) {
        String id = clusterId(type, key);
        members.forEach(fp -> assignment.put(fp, id));
        String category = key.substring(0, key.indexOf('|'));
        return Cluster.builder()
            .id(id)
            .type(type)
            .category(category)
            .key(key.substring(key.indexOf('|') + 1))
            .members(members)
            .build();
    }
    
    static String clusterId(ClusterType type, String key) {
        String label = type == ClusterType.PATTERN ? "PATTERN" : "FILE";
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return "CLUSTER-" + label + "-" + HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }
    
    /**
     * Имя первой вызываемой функции-хелпера во фрагменте кода
     */
    static String helperCall(UnifiedFinding finding) {
        if (finding.getLocation() == null || finding.getLocation().getSnippet() == null) {
            return null;
        }
        Matcher matcher = BARE_CALL.matcher(finding.getLocation().getSnippet());
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!IGNORED_CALLS.contains(name.toLowerCase(Locale.ROOT))) {
                return name;
            }
        }
        return null;
    }
}
