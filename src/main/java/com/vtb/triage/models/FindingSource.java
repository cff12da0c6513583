package com.vtb.triage.models;

import java.util.Comparator;
import java.util.Objects;

/**
 * Пара (инструмент, правило), независимо сообщившая о находке
 */
public record FindingSource(String tool, String ruleId) implements Comparable<FindingSource> {
    
    private static final Comparator<FindingSource> ORDER = Comparator
        .comparing(FindingSource::tool, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(FindingSource::ruleId, Comparator.nullsFirst(Comparator.naturalOrder()));
    
    public FindingSource {
        Objects.requireNonNull(tool, "tool");
        ruleId = ruleId == null ? "" : ruleId;
    }
    
    @Override
    public int compareTo(FindingSource other) {
        return ORDER.compare(this, other);
    }
}
