package com.vtb.triage.reports;

import com.vtb.triage.config.ConfigurationException;
import com.vtb.triage.config.EngineConfig;
import com.vtb.triage.engine.TriageEngine;
import com.vtb.triage.models.AdapterOutcome;
import com.vtb.triage.models.FindingSource;
import com.vtb.triage.models.Location;
import com.vtb.triage.models.OrchestrationResult;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.TriageReport;
import com.vtb.triage.models.TriagedFinding;
import com.vtb.triage.models.UnifiedFinding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreTest {
    
    @TempDir
    Path temp;
    
    private final SnapshotStore store = new SnapshotStore();
    private final TriageEngine engine = new TriageEngine();
    private final EngineConfig config = EngineConfig.defaults();
    
    @Test
    void savedSnapshotLoadsBackEqual() throws Exception {
        TriageReport report = report(List.of(
            finding("aaaa000000000001", "CWE-89", "app/db.py", "q = \"SELECT \" + x"),
            finding("aaaa000000000002", "CWE-327", "app/auth.py", "h = md5(password)")));
        Path file = temp.resolve("snapshots/run-1.json");
        
        store.save(report, file);
        TriageReport loaded = store.load(file);
        
        assertTrue(Files.readString(file).contains("\"snapshotVersion\" : 1"));
        assertEquals(report.getFindings(), loaded.getFindings());
        assertEquals(report.getClusters(), loaded.getClusters());
        assertEquals(report.getAdapterOutcomes(), loaded.getAdapterOutcomes());
        assertEquals(report.getGeneratedAt(), loaded.getGeneratedAt());
        try (var files = Files.list(file.getParent())) {
            assertEquals(1, files.count(), "Временные файлы не остаются");
        }
    }
    
    @Test
    void loadedSnapshotRetriagesToSameResult() throws Exception {
        TriageReport report = report(List.of(
            finding("bbbb000000000001", "CWE-798", "app/settings.py", "API_KEY = \"sk_live_9aF3kQ2xLm7ZpR4tVb8N\""),
            finding("bbbb000000000002", "CWE-22", "app/files.py", "open(request.args['f'])")));
        Path file = temp.resolve("run.json");
        store.save(report, file);
        
        List<TriagedFinding> again = engine.triage(store.load(file).unifiedFindings(), config);
        
        assertEquals(report.getFindings(), again);
    }
    
    @Test
    void newerSnapshotVersionIsRejected() throws Exception {
        Path file = temp.resolve("future.json");
        Files.writeString(file, "{\"snapshotVersion\": 2, \"findings\": []}");
        
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> store.load(file));
        assertTrue(error.getMessage().contains("2"));
        
        Path unversioned = temp.resolve("old.json");
        Files.writeString(unversioned, "{\"findings\": []}");
        assertThrows(ConfigurationException.class, () -> store.load(unversioned));
    }
    
    @Test
    void diffSplitsNewResolvedAndPersisting() {
        TriageReport before = report(List.of(
            finding("cccc000000000001", "CWE-89", "a.py", "q = \"x\" + a"),
            finding("cccc000000000002", "CWE-79", "b.js", "el.innerHTML = v")));
        TriageReport after = report(List.of(
            finding("cccc000000000002", "CWE-79", "b.js", "el.innerHTML = v"),
            finding("cccc000000000003", "CWE-78", "c.py", "os.system(cmd)")));
        
        SnapshotStore.SnapshotDiff diff = store.diff(before, after);
        
        assertEquals(Set.of("cccc000000000003"), diff.newFindings());
        assertEquals(Set.of("cccc000000000001"), diff.resolvedFindings());
        assertEquals(Set.of("cccc000000000002"), diff.persistingFindings());
        assertTrue(diff.hasRegressions());
        assertFalse(store.diff(after, after).hasRegressions());
    }
    
    private TriageReport report(List<UnifiedFinding> findings) {
        OrchestrationResult orchestration = OrchestrationResult.builder()
            .findings(findings)
            .outcomes(List.of(AdapterOutcome.skipped("nuclei", "targetUrl не задан")))
            .build();
        return engine.buildReport(temp, orchestration, config);
    }
    
    private static UnifiedFinding finding(String fingerprint, String category, String file, String snippet) {
        TreeSet<FindingSource> sources = new TreeSet<>();
        sources.add(new FindingSource("semgrep", "rule-" + category));
        TreeSet<String> references = new TreeSet<>();
        references.add("https://cwe.mitre.org/");
        return UnifiedFinding.builder()
            .fingerprint(fingerprint)
            .category(category)
            .sources(sources)
            .references(references)
            .severity(Severity.HIGH)
            .locationSeverity(Severity.HIGH)
            .rawMessage("message " + fingerprint)
            .location(Location.builder().file(file).lineStart(3).lineEnd(4).column(5).snippet(snippet).build())
            .build();
    }
}
