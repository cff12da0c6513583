package com.vtb.triage.core;

import com.vtb.triage.models.FindingSource;
import com.vtb.triage.models.UnifiedFinding;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Накопитель дедупликации: вставка или слияние по fingerprint.
 * Не потокобезопасен, используется после join всех адаптеров.
 *
 * Если у находки нет фрагмента кода, её fingerprint привязан к строке, и разные
 * инструменты, указавшие на соседние строки, получают разные fingerprint.
 * Такие находки доливаются при выдаче: та же категория, тот же файл, непересекающиеся
 * инструменты и расстояние не больше lineTolerance строк.
 */
@Slf4j
public class FindingMerger {
    
    private static final Comparator<UnifiedFinding> BY_LINE = Comparator
        .comparingInt((UnifiedFinding f) -> f.getLocation().getLineStart())
        .thenComparing(UnifiedFinding::getFingerprint);
    
    private final int lineTolerance;
    private final Map<String, UnifiedFinding> byFingerprint = new LinkedHashMap<>();
    
    public FindingMerger() {
        this(0);
    }
    
    /**
     * @param lineTolerance допустимое расстояние в строках для слияния находок без фрагмента; 0 отключает
     */
    public FindingMerger(int lineTolerance) {
        this.lineTolerance = Math.max(lineTolerance, 0);
    }
    
    /**
     * @return true, если находка новая; false, если слита с существующей
     */
    public boolean add(UnifiedFinding finding) {
        UnifiedFinding existing = byFingerprint.get(finding.getFingerprint());
        if (existing == null) {
            byFingerprint.put(finding.getFingerprint(), finding);
            return true;
        }
        existing.mergeFrom(finding);
        return false;
    }
    
    public void addAll(Iterable<UnifiedFinding> findings) {
        findings.forEach(this::add);
    }
    
    public int size() {
        return byFingerprint.size();
    }
    
    /**
     * Находки после слияния соседних строк, отсортированные по fingerprint
     */
    public List<UnifiedFinding> findings() {
        List<UnifiedFinding> result = lineTolerance > 0
            ? mergeNearby(byFingerprint.values())
            : new ArrayList<>(byFingerprint.values());
        result.sort(Comparator.comparing(UnifiedFinding::getFingerprint));
        return result;
    }
    
    private List<UnifiedFinding> mergeNearby(Iterable<UnifiedFinding> findings) {
        // Ключ "файл|категория" в TreeMap, чтобы порядок не зависел от порядка вставки
        Map<String, List<UnifiedFinding>> byPlace = new TreeMap<>();
        List<UnifiedFinding> result = new ArrayList<>();
        for (UnifiedFinding finding : findings) {
            if (finding.getLocation() == null || finding.getLocation().getLineStart() <= 0) {
                result.add(finding);
                continue;
            }
            byPlace.computeIfAbsent(finding.getLocation().getFile() + "|" + finding.getCategory(),
                key -> new ArrayList<>()).add(finding);
        }
        
        for (List<UnifiedFinding> place : byPlace.values()) {
            place.sort(BY_LINE);
            List<UnifiedFinding> group = new ArrayList<>();
            for (UnifiedFinding candidate : place) {
                if (!group.isEmpty() && !joins(group, candidate)) {
                    result.add(collapse(group));
                    group = new ArrayList<>();
                }
                group.add(candidate);
            }
            if (!group.isEmpty()) {
                result.add(collapse(group));
            }
        }
        return result;
    }
    
    private boolean joins(List<UnifiedFinding> group, UnifiedFinding candidate) {
        UnifiedFinding last = group.get(group.size() - 1);
        if (candidate.getLocation().getLineStart() - last.getLocation().getLineStart() > lineTolerance) {
            return false;
        }
        // Две находки с разными фрагментами кода указывают на разные места
        if (hasCodeAnchor(candidate) && group.stream().allMatch(FindingMerger::hasCodeAnchor)) {
            return false;
        }
        Set<String> groupTools = new HashSet<>();
        group.forEach(f -> f.getSources().forEach(s -> groupTools.add(s.tool())));
        return candidate.getSources().stream().map(FindingSource::tool).noneMatch(groupTools::contains);
    }
    
    /**
     * Группа сливается в находку с наименьшим fingerprint, остальные поглощаются по порядку fingerprint
     */
    private static UnifiedFinding collapse(List<UnifiedFinding> group) {
        if (group.size() == 1) {
            return group.get(0);
        }
        List<UnifiedFinding> ordered = new ArrayList<>(group);
        ordered.sort(Comparator.comparing(UnifiedFinding::getFingerprint));
        UnifiedFinding base = ordered.get(0);
        for (int i = 1; i < ordered.size(); i++) {
            base.absorbNearby(ordered.get(i));
        }
        log.debug("Слиты соседние находки {} в {}", ordered.size(), base.getFingerprint());
        return base;
    }
    
    private static boolean hasCodeAnchor(UnifiedFinding finding) {
        return FingerprintCalculator.anchorFromSnippet(finding.getLocation().getSnippet()) != null;
    }
}
