package com.vtb.triage.reports;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.triage.config.ConfigurationException;
import com.vtb.triage.models.TriageReport;
import com.vtb.triage.models.TriagedFinding;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Снимок результатов сканирования в JSON для повторного триажа и сравнения с историей.
 * Верхнеуровневое поле snapshotVersion защищает от чтения несовместимых снимков.
 */
@Slf4j
public class SnapshotStore {
    
    private final ObjectMapper objectMapper;
    
    /**
     * Разница между двумя снимками по fingerprint
     */
    public record SnapshotDiff(SortedSet<String> newFindings,
                               SortedSet<String> resolvedFindings,
                               SortedSet<String> persistingFindings) {
        
        public boolean hasRegressions() {
            return !newFindings.isEmpty();
        }
    }
    
    public SnapshotStore() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Новые необязательные поля той же версии не ломают чтение
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    public void save(TriageReport report, Path path) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("TriageReport не может быть null");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        
        // Через временный файл, чтобы не оставить обрезанный снимок
        Path temp = Files.createTempFile(parent, ".snapshot-", ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), report);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Снимок сохранён: {} ({} находок, {} байт)", path, report.getFindings().size(), Files.size(path));
    }
    
    /**
     * @throws ConfigurationException если версия снимка отсутствует или новее поддерживаемой
     */
    public TriageReport load(Path path) throws IOException {
        JsonNode root = objectMapper.readTree(path.toFile());
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Снимок повреждён: " + path);
        }
        JsonNode version = root.get("snapshotVersion");
        if (version == null || !version.canConvertToInt()) {
            throw new ConfigurationException("В снимке нет snapshotVersion: " + path);
        }
        if (version.asInt() > TriageReport.CURRENT_SNAPSHOT_VERSION) {
            throw new ConfigurationException("Версия снимка " + version.asInt()
                + " новее поддерживаемой " + TriageReport.CURRENT_SNAPSHOT_VERSION + ": " + path);
        }
        TriageReport report = objectMapper.treeToValue(root, TriageReport.class);
        log.debug("Снимок загружен: {} ({} находок)", path, report.getFindings().size());
        return report;
    }
    
    public SnapshotDiff diff(TriageReport previous, TriageReport current) {
        SortedSet<String> before = fingerprints(previous);
        SortedSet<String> after = fingerprints(current);
        
        SortedSet<String> added = new TreeSet<>(after);
        added.removeAll(before);
        SortedSet<String> resolved = new TreeSet<>(before);
        resolved.removeAll(after);
        SortedSet<String> persisting = new TreeSet<>(after);
        persisting.retainAll(before);
        
        log.info("Сравнение снимков: новых {}, исправлено {}, осталось {}",
            added.size(), resolved.size(), persisting.size());
        return new SnapshotDiff(
            Collections.unmodifiableSortedSet(added),
            Collections.unmodifiableSortedSet(resolved),
            Collections.unmodifiableSortedSet(persisting));
    }
    
    private static SortedSet<String> fingerprints(TriageReport report) {
        if (report == null) {
            return new TreeSet<>();
        }
        return report.getFindings().stream()
            .map(TriagedFinding::getFingerprint)
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
