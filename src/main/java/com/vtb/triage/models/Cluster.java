package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.SortedSet;

/**
 * Группа связанных находок (по fingerprint)
 */
@Value
@Builder
@Jacksonized
public class Cluster {
    String id;
    ClusterType type;
    String category;
    /** Файл или сигнатура паттерна */
    String key;
    SortedSet<String> members;
}
