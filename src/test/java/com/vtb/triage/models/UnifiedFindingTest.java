package com.vtb.triage.models;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedFindingTest {
    
    @Test
    void mergeUnionsSourcesAndKeepsHighestSeverity() {
        UnifiedFinding semgrep = finding("fp1", "semgrep", "python-sql", Severity.MEDIUM, Confidence.MEDIUM,
            "SQL injection", 42, "https://cwe.mitre.org/data/definitions/89.html");
        UnifiedFinding bandit = finding("fp1", "bandit", "B608", Severity.HIGH, Confidence.MEDIUM,
            "Possible SQL injection vector through string-based query construction", 42,
            "https://bandit.readthedocs.io/B608");
        
        semgrep.mergeFrom(bandit);
        
        assertEquals(2, semgrep.getSources().size());
        assertEquals(2, semgrep.distinctToolCount());
        assertEquals(Severity.HIGH, semgrep.getSeverity(), "Критичность должна быть максимальной");
        assertEquals(2, semgrep.getReferences().size());
        assertTrue(semgrep.getRawMessage().startsWith("Possible"), "Сохраняется более подробное сообщение");
    }
    
    @Test
    void mergeIsCommutativeExceptForTieLocation() {
        UnifiedFinding a1 = finding("fp", "semgrep", "r1", Severity.LOW, Confidence.MEDIUM, "aaa", 10, "ref-a");
        UnifiedFinding b1 = finding("fp", "bandit", "r2", Severity.CRITICAL, Confidence.LOW, "bbb", 11, "ref-b");
        UnifiedFinding a2 = finding("fp", "semgrep", "r1", Severity.LOW, Confidence.MEDIUM, "aaa", 10, "ref-a");
        UnifiedFinding b2 = finding("fp", "bandit", "r2", Severity.CRITICAL, Confidence.LOW, "bbb", 11, "ref-b");
        
        a1.mergeFrom(b1);
        b2.mergeFrom(a2);
        
        assertEquals(a1.getSources(), b2.getSources());
        assertEquals(a1.getReferences(), b2.getReferences());
        assertEquals(a1.getSeverity(), b2.getSeverity());
        assertEquals(a1.getRawMessage(), b2.getRawMessage());
        assertEquals(10, a1.getLocation().getLineStart());
        assertEquals(10, b2.getLocation().getLineStart(), "Место с более высокой уверенностью побеждает");
    }
    
    @Test
    void locationTieKeepsFirstSeen() {
        UnifiedFinding first = finding("fp", "semgrep", "r1", Severity.HIGH, Confidence.HIGH, "m", 5, null);
        UnifiedFinding second = finding("fp", "bandit", "r2", Severity.HIGH, Confidence.HIGH, "m", 7, null);
        
        first.mergeFrom(second);
        
        assertEquals(5, first.getLocation().getLineStart());
    }
    
    @Test
    void higherSeveritySourceWinsLocationOnEqualConfidence() {
        UnifiedFinding first = finding("fp", "semgrep", "r1", Severity.LOW, Confidence.HIGH, "m", 5, null);
        UnifiedFinding second = finding("fp", "bandit", "r2", Severity.HIGH, Confidence.HIGH, "m", 7, null);
        
        first.mergeFrom(second);
        
        assertEquals(7, first.getLocation().getLineStart());
    }
    
    @Test
    void mergingDifferentFingerprintsFails() {
        UnifiedFinding a = finding("fp-a", "semgrep", "r", Severity.LOW, Confidence.LOW, "m", 1, null);
        UnifiedFinding b = finding("fp-b", "semgrep", "r", Severity.LOW, Confidence.LOW, "m", 1, null);
        
        assertThrows(IllegalArgumentException.class, () -> a.mergeFrom(b));
    }
    
    @Test
    void sourcesAreReadOnlyFromOutside() {
        UnifiedFinding f = finding("fp", "semgrep", "r", Severity.LOW, Confidence.LOW, "m", 1, null);
        
        assertThrows(UnsupportedOperationException.class,
            () -> f.getSources().add(new FindingSource("bandit", "B1")));
        assertEquals("CWE-89: r", f.getTitle());
    }
    
    @Test
    void severityNormalization() {
        assertEquals(Severity.HIGH, Severity.fromRaw("ERROR"));
        assertEquals(Severity.MEDIUM, Severity.fromRaw("warning"));
        assertEquals(Severity.LOW, Severity.fromRaw("note"));
        assertEquals(Severity.INFO, Severity.fromRaw("whatever"));
        assertEquals(Severity.INFO, Severity.fromRaw(null));
        assertEquals(Severity.CRITICAL, Severity.parse(" critical "));
        assertThrows(IllegalArgumentException.class, () -> Severity.parse("SEVERE"));
        assertTrue(Severity.MEDIUM.isAtLeast(Severity.LOW));
        assertFalse(Severity.INFO.isAtLeast(Severity.LOW));
    }
    
    @Test
    void riskScoreAlwaysFiniteAndPositive() {
        RiskScore normal = RiskScore.of(8, 9, 2, 0.5);
        assertEquals(36.0, normal.getValue(), 1e-9);
        
        RiskScore zeroTime = RiskScore.of(5, 5, 0, 0.5);
        assertEquals(50.0, zeroTime.getValue(), 1e-9, "Время обнаружения ограничено снизу");
        
        RiskScore tiny = RiskScore.of(0, 1, 100, 0.5);
        assertTrue(tiny.getValue() > 0);
        
        RiskScore badFloor = RiskScore.of(2, 2, Double.NaN, 0);
        assertTrue(Double.isFinite(badFloor.getValue()));
        assertEquals(4.0, badFloor.getValue(), 1e-9);
    }
    
    @Test
    void lowRisksKeepTheirOrder() {
        RiskScore slow = RiskScore.of(1, 1, 180, 1);
        RiskScore faster = RiskScore.of(1, 1, 90, 1);
        
        assertTrue(faster.getValue() > slow.getValue(), "Малые оценки не должны схлопываться при округлении");
        assertEquals(0.01, slow.getDisplayValue(), 1e-9);
        assertEquals(0.01, faster.getDisplayValue(), 1e-9);
        assertEquals(36.0, RiskScore.of(8, 9, 2, 0.5).getDisplayValue(), 1e-9);
    }
    
    @Test
    void findingSourceOrdering() {
        TreeSet<FindingSource> set = new TreeSet<>(List.of(
            new FindingSource("semgrep", "b"),
            new FindingSource("bandit", "z"),
            new FindingSource("semgrep", null)));
        
        assertEquals(new FindingSource("bandit", "z"), set.first());
        assertEquals(new FindingSource("semgrep", "b"), set.last());
        assertTrue(set.contains(new FindingSource("semgrep", "")), "null ruleId приводится к пустой строке");
    }
    
    static UnifiedFinding finding(String fp, String tool, String rule, Severity severity, Confidence confidence,
                                  String message, int line, String reference) {
        TreeSet<FindingSource> sources = new TreeSet<>();
        sources.add(new FindingSource(tool, rule));
        TreeSet<String> references = new TreeSet<>();
        if (reference != null) {
            references.add(reference);
        }
        return UnifiedFinding.builder()
            .fingerprint(fp)
            .category("CWE-89")
            .sources(sources)
            .references(references)
            .location(Location.builder().file("app.py").lineStart(line).lineEnd(line).build())
            .severity(severity)
            .rawMessage(message)
            .locationConfidence(confidence)
            .locationSeverity(severity)
            .build();
    }
}
