package com.vtb.triage.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.FindingSource;
import com.vtb.triage.models.Location;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.UnifiedFinding;
import com.vtb.triage.models.Verdict;
import lombok.Builder;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Сверка классификации с размеченным эталонным набором (TP/FP).
 * Целевая точность 85% проверяется тестом, в рантайме не применяется.
 */
@Slf4j
public class TriageBenchmark {
    
    public static final double TARGET_ACCURACY = 0.85;
    
    private final ClassifierChain chain;
    
    public TriageBenchmark(ClassifierChain chain) {
        this.chain = chain;
    }
    
    /**
     * Размеченный случай
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Case {
        private String id;
        private String category;
        private String severity;
        private String file;
        private int line;
        private String snippet;
        private List<String> tools = new ArrayList<>();
        private Verdict expected;
    }
    
    @Value
    @Builder
    public static class Result {
        int total;
        int correct;
        Map<String, Double> perCategoryAccuracy;
        List<String> failures;
        
        public double getAccuracy() {
            return total == 0 ? 0.0 : (double) correct / total;
        }
        
        public boolean meetsTarget() {
            return getAccuracy() >= TARGET_ACCURACY;
        }
    }
    
    public static List<Case> load(InputStream json) throws IOException {
        return new ObjectMapper().readValue(json, new TypeReference<List<Case>>() {});
    }
    
    public Result evaluate(List<Case> cases) {
        int correct = 0;
        Map<String, int[]> byCategory = new TreeMap<>();
        List<String> failures = new ArrayList<>();
        
        for (Case c : cases) {
            Classification classification = chain.classify(toFinding(c));
            boolean agrees = classification.getVerdict() == c.getExpected();
            int[] counters = byCategory.computeIfAbsent(c.getCategory(), k -> new int[2]);
            counters[1]++;
            if (agrees) {
                correct++;
                counters[0]++;
            } else {
                failures.add(c.getId() + ": ожидалось " + c.getExpected() + ", получено "
                    + classification.getVerdict() + " (" + classification.getClassifierId() + ")");
            }
        }
        
        Map<String, Double> perCategory = new TreeMap<>();
        byCategory.forEach((category, counters) -> perCategory.put(category, (double) counters[0] / counters[1]));
        
        Result result = Result.builder()
            .total(cases.size())
            .correct(correct)
            .perCategoryAccuracy(perCategory)
            .failures(failures)
            .build();
        log.info("Точность триажа: {}/{} ({}%)", correct, cases.size(), Math.round(result.getAccuracy() * 100));
        failures.forEach(f -> log.debug("  расхождение {}", f));
        return result;
    }
    
    static UnifiedFinding toFinding(Case c) {
        TreeSet<FindingSource> sources = new TreeSet<>();
        List<String> tools = c.getTools() == null || c.getTools().isEmpty() ? List.of("benchmark") : c.getTools();
        tools.forEach(tool -> sources.add(new FindingSource(tool, c.getId())));
        Severity severity = Severity.fromRaw(c.getSeverity());
        
        return UnifiedFinding.builder()
            .fingerprint(c.getId())
            .category(c.getCategory())
            .sources(sources)
            .severity(severity)
            .locationSeverity(severity)
            .location(Location.builder()
                .file(c.getFile())
                .lineStart(c.getLine())
                .lineEnd(c.getLine())
                .snippet(c.getSnippet())
                .build())
            .build();
    }
}
