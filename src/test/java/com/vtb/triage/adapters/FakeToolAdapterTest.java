package com.vtb.triage.adapters;

import com.vtb.triage.discovery.SystemPathStrategy;
import com.vtb.triage.discovery.ToolDiscovery;
import com.vtb.triage.models.RawFinding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Адаптеры против shell-скриптов, имитирующих настоящие инструменты
 */
@DisabledOnOs(OS.WINDOWS)
class FakeToolAdapterTest {
    
    @TempDir
    Path bin;
    
    @Test
    void semgrepExitCodeOneIsSuccess() throws Exception {
        Path output = copyFixture("semgrep-output.json");
        fakeTool("semgrep", "cat '" + output + "'\nexit 1");
        
        List<RawFinding> findings = new SemgrepAdapter(discovery()).scan(bin, AdapterSettings.defaults());
        
        assertEquals(2, findings.size());
    }
    
    @Test
    void semgrepExitCodeTwoIsExecutionError() throws Exception {
        fakeTool("semgrep", "echo 'invalid config' 1>&2\nexit 2");
        
        AdapterExecutionException error = assertThrows(AdapterExecutionException.class,
            () -> new SemgrepAdapter(discovery()).scan(bin, AdapterSettings.defaults()));
        assertTrue(error.getMessage().contains("invalid config"));
    }
    
    @Test
    void outputHeldOpenByChildProcessGivesNoFindings() throws Exception {
        Path output = copyFixture("semgrep-output.json");
        // Фоновый процесс наследует stdout и не даёт дочитать вывод до конца
        fakeTool("semgrep", "head -c 200 '" + output + "'\nsleep 3 &\nexit 1");
        SemgrepAdapter adapter = new SemgrepAdapter(discovery(), new ProcessRunner(Duration.ofMillis(300)));
        
        List<RawFinding> findings = adapter.scan(bin, AdapterSettings.defaults());
        
        assertTrue(findings.isEmpty(), "Обрезанный вывод не должен разбираться");
    }
    
    @Test
    void hangingToolTimesOut() throws Exception {
        fakeTool("bandit", "sleep 30");
        AdapterSettings settings = AdapterSettings.builder().timeout(Duration.ofMillis(500)).build();
        
        assertThrows(AdapterTimeoutException.class, () -> new BanditAdapter(discovery()).scan(bin, settings));
    }
    
    @Test
    void versionIsParsedOnceAndCached() throws Exception {
        Path counter = bin.resolve("calls");
        fakeTool("bandit", "echo x >> '" + counter + "'\necho 'bandit 1.7.5'\necho '  python version = 3.11.4'");
        BanditAdapter adapter = new BanditAdapter(discovery());
        
        assertEquals("1.7.5", adapter.version().orElseThrow());
        assertEquals("1.7.5", adapter.version().orElseThrow());
        assertEquals(1, Files.readAllLines(counter).size(), "--version должен запускаться один раз");
    }
    
    @Test
    void unavailableToolIsReportedWithInstructions() {
        SemgrepAdapter adapter = new SemgrepAdapter(discovery());
        
        assertFalse(adapter.isAvailable());
        assertTrue(adapter.version().isEmpty());
        assertTrue(adapter.installInstructions().contains("pip install semgrep"));
    }
    
    private ToolDiscovery discovery() {
        return new ToolDiscovery(List.of(new SystemPathStrategy(bin.toString())));
    }
    
    private void fakeTool(String name, String body) throws IOException {
        Path script = bin.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        assertTrue(script.toFile().setExecutable(true));
    }
    
    private Path copyFixture(String name) throws IOException {
        Path target = bin.resolve(name);
        try (InputStream is = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(is);
            Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
