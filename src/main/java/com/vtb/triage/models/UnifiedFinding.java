package com.vtb.triage.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.Comparator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Находка в едином формате (UFF).
 * 
 * Изменяется только через {@link #mergeFrom(UnifiedFinding)} и {@link #absorbNearby(UnifiedFinding)}: при слиянии растут
 * sources/references, повышается severity и может уточниться location.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder
@Jacksonized
public class UnifiedFinding {
    
    private static final Comparator<String> MESSAGE_ORDER = Comparator
        .comparingInt(String::length)
        .reversed()
        .thenComparing(Comparator.naturalOrder());
    
    private final String fingerprint;
    private final String category;
    
    @Builder.Default
    private final SortedSet<FindingSource> sources = new TreeSet<>();
    
    @Builder.Default
    private final SortedSet<String> references = new TreeSet<>();
    
    private Location location;
    private Severity severity;
    private String rawMessage;
    
    // Уверенность и критичность того источника, чьё местоположение сейчас выбрано
    private Confidence locationConfidence;
    private Severity locationSeverity;
    
    public SortedSet<FindingSource> getSources() {
        return Collections.unmodifiableSortedSet(sources);
    }
    
    public SortedSet<String> getReferences() {
        return Collections.unmodifiableSortedSet(references);
    }
    
    /**
     * Короткий заголовок: категория и первое (в порядке сортировки) правило
     */
    @JsonIgnore
    public String getTitle() {
        String rule = sources.isEmpty() ? "" : sources.first().ruleId();
        return rule.isEmpty() ? category : category + ": " + rule;
    }
    
    /**
     * Количество разных инструментов, подтвердивших находку
     */
    @JsonIgnore
    public long distinctToolCount() {
        return sources.stream().map(FindingSource::tool).distinct().count();
    }
    
    /**
     * Слить находку с тем же fingerprint.
     * 
     * Операция коммутативна по sources, severity, references и сообщению.
     * Location переходит к источнику со строго большей парой (confidence, severity),
     * при равенстве остаётся первое увиденное значение.
     */
    public void mergeFrom(UnifiedFinding other) {
        if (other == null) {
            return;
        }
        if (!fingerprint.equals(other.fingerprint)) {
            throw new IllegalArgumentException(
                "Нельзя слить находки с разными fingerprint: " + fingerprint + " / " + other.fingerprint);
        }
        mergeContent(other);
    }
    
    /**
     * Поглотить находку другого инструмента о том же месте, у которой fingerprint
     * отличается из-за соседней строки. Fingerprint остаётся прежним.
     */
    public void absorbNearby(UnifiedFinding other) {
        if (other == null) {
            return;
        }
        if (!category.equals(other.category) || location == null || other.location == null
                || !location.getFile().equals(other.location.getFile())) {
            throw new IllegalArgumentException(
                "Поглощать можно только находку той же категории в том же файле: " + fingerprint + " / " + other.fingerprint);
        }
        mergeContent(other);
    }
    
    private void mergeContent(UnifiedFinding other) {
        sources.addAll(other.sources);
        references.addAll(other.references);
        severity = Severity.max(severity, other.severity);
        rawMessage = moreInformative(rawMessage, other.rawMessage);
        
        if (outranksLocation(other)) {
            location = other.location;
            locationConfidence = other.locationConfidence;
            locationSeverity = other.locationSeverity;
        }
    }
    
    private boolean outranksLocation(UnifiedFinding other) {
        if (other.location == null) {
            return false;
        }
        if (location == null) {
            return true;
        }
        int ours = rank(locationConfidence);
        int theirs = rank(other.locationConfidence);
        if (theirs != ours) {
            return theirs > ours;
        }
        int ourSeverity = locationSeverity != null ? locationSeverity.getPriority() : 0;
        int theirSeverity = other.locationSeverity != null ? other.locationSeverity.getPriority() : 0;
        return theirSeverity > ourSeverity;
    }
    
    private static int rank(Confidence confidence) {
        return confidence != null ? confidence.getRank() : 0;
    }
    
    private static String moreInformative(String a, String b) {
        if (a == null || a.isBlank()) return b;
        if (b == null || b.isBlank()) return a;
        return MESSAGE_ORDER.compare(a, b) <= 0 ? a : b;
    }
}
