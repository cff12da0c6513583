package com.vtb.triage.adapters;

import com.vtb.triage.discovery.ToolDiscovery;
import com.vtb.triage.models.RawFinding;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdapterParsersTest {
    
    private final ToolDiscovery noTools = new ToolDiscovery(List.of());
    
    @Test
    void semgrepResultsAreParsedWithCweAndSnippet() throws IOException {
        List<RawFinding> findings = new SemgrepAdapter(noTools).parse(fixture("semgrep-output.json"));
        
        assertEquals(2, findings.size(), "Результат без check_id должен быть пропущен");
        RawFinding sql = findings.get(0);
        assertEquals("semgrep", sql.getTool());
        assertEquals("app/db.py", sql.getFilePath());
        assertEquals(42, sql.getLine());
        assertEquals(5, sql.getColumn());
        assertEquals("ERROR", sql.getRawSeverity());
        assertEquals("HIGH", sql.getRawConfidence());
        assertTrue(sql.getCategoryHint().startsWith("CWE-89"));
        assertTrue(sql.getSnippet().contains("cursor.execute"));
        assertEquals(List.of("https://owasp.org/Top10/A03_2021-Injection"), sql.getReferences());
        
        RawFinding md5 = findings.get(1);
        assertTrue(md5.getCategoryHint().startsWith("CWE-327"), "cwe строкой тоже поддерживается");
    }
    
    @Test
    void banditResultsKeepOnlyReportedLineAsSnippet() throws IOException {
        List<RawFinding> findings = new BanditAdapter(noTools).parse(fixture("bandit-output.json"));
        
        assertEquals(2, findings.size());
        RawFinding sql = findings.get(0);
        assertEquals("B608", sql.getRuleId());
        assertEquals("CWE-89", sql.getCategoryHint());
        assertEquals("    cursor.execute(\"SELECT * FROM users WHERE id = \" + user_id)", sql.getSnippet());
        assertEquals(Integer.valueOf(42), sql.getEndLine());
        assertEquals(1, sql.getReferences().size());
    }
    
    @Test
    void nucleiSkipsBrokenLinesAndUsesUrlPath() throws IOException {
        List<RawFinding> findings = new NucleiAdapter(noTools).parse(fixture("nuclei-output.jsonl"));
        
        assertEquals(2, findings.size(), "Битая строка JSONL пропускается");
        assertEquals("/.env", findings.get(0).getFilePath());
        assertEquals("cwe-200", findings.get(0).getCategoryHint());
        assertEquals("high", findings.get(0).getRawSeverity());
        assertEquals("/", findings.get(1).getFilePath());
    }
    
    @Test
    void malformedOutputGivesZeroFindings() {
        assertTrue(new SemgrepAdapter(noTools).parse("{\"results\": [ {\"check_id\": ").isEmpty());
        assertTrue(new SemgrepAdapter(noTools).parse("<html>502 Bad Gateway</html>").isEmpty());
        assertTrue(new SemgrepAdapter(noTools).parse("{\"errors\": []}").isEmpty());
        assertTrue(new BanditAdapter(noTools).parse("Traceback (most recent call last):").isEmpty());
        assertTrue(new NucleiAdapter(noTools).parse("[INF] no results").isEmpty());
        assertTrue(new SemgrepAdapter(noTools).parse("").isEmpty());
    }
    
    @Test
    void semgrepCommandCarriesRulesetsAndFilters() {
        AdapterSettings settings = AdapterSettings.builder()
            .ruleset("p/owasp-top-ten")
            .includeGlob("*.py")
            .excludeGlob("tests/**")
            .build();
        
        List<String> command = new SemgrepAdapter(noTools).buildCommand("semgrep", Path.of("/src"), settings);
        
        assertEquals(List.of("semgrep", "--config", "p/owasp-top-ten", "--json", "--quiet",
            "--include", "*.py", "--exclude", "tests/**", Path.of("/src").toString()), command);
    }
    
    @Test
    void banditCommandJoinsExcludes() {
        AdapterSettings settings = AdapterSettings.builder()
            .excludeGlob("tests")
            .excludeGlob("migrations")
            .build();
        
        List<String> command = new BanditAdapter(noTools).buildCommand("bandit", Path.of("app"), settings);
        
        assertEquals(List.of("bandit", "-r", "-f", "json", "-q", "-x", "tests,migrations", "app"), command);
    }
    
    @Test
    void nucleiWithoutTargetUrlReturnsNothing() throws Exception {
        assertTrue(new NucleiAdapter(noTools).scan(Path.of("."), AdapterSettings.defaults()).isEmpty(),
            "Без targetUrl DAST-сканирование пропускается");
    }
    
    private String fixture(String name) throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(is, "Фикстура не найдена: " + name);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
