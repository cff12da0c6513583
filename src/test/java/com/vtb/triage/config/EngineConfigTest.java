package com.vtb.triage.config;

import com.vtb.triage.models.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {
    
    @TempDir
    Path temp;
    
    @Test
    void classpathConfigIsLoaded() {
        EngineConfig config = EngineConfig.load();
        
        assertEquals(List.of("semgrep", "bandit"), config.getAdapters());
        assertEquals(Duration.ofSeconds(300), config.getAdapterTimeout());
        assertEquals(Duration.ofSeconds(600), config.getAdapterTimeout("nuclei"), "Переопределение тайм-аута");
        assertEquals(Severity.INFO, config.getSeverityFloorLevel());
        assertEquals(8.5, config.getRiskTables().getExploitabilityByCategory().get("CWE-89"), 1e-9);
        assertEquals(List.of("auto"), config.optionsFor("semgrep").getRulesets());
        assertTrue(config.getExclude().contains("**/node_modules/**"));
    }
    
    @Test
    void fileConfigFillsMissingValues() throws Exception {
        Path file = temp.resolve("custom.yaml");
        Files.writeString(file, """
            adapters: [bandit]
            severityFloor: medium
            runTimeoutSec: 30
            unknownKey: ignored
            """);
        
        EngineConfig config = EngineConfig.load(file);
        config.validate(List.of("semgrep", "bandit"));
        
        assertEquals(List.of("bandit"), config.getAdapters());
        assertEquals(Severity.MEDIUM, config.getSeverityFloorLevel());
        assertEquals(Duration.ofSeconds(30), config.getRunTimeout(List.of("semgrep", "bandit", "nuclei")));
        assertEquals(10, config.getFingerprint().getLineBucketSize());
        assertEquals(500, config.getTriage().getExplanationMaxLength());
        assertEquals(9.5, config.getRiskTables().getImpactBySeverity().get("CRITICAL"), 1e-9);
        assertEquals("CWE-89", config.getCategoryMapping().get("sql"));
    }
    
    @Test
    void runBudgetDefaultsToSumOfAdapterTimeouts() {
        EngineConfig config = EngineConfig.defaults();
        config.setAdapterTimeoutSec(20);
        EngineConfig.AdapterOptions nuclei = new EngineConfig.AdapterOptions();
        nuclei.setTimeoutSec(100);
        config.getAdapterSettings().put("nuclei", nuclei);
        
        assertEquals(Duration.ofSeconds(140), config.getRunTimeout(List.of("semgrep", "bandit", "nuclei")));
        assertEquals(Duration.ofSeconds(40), config.getRunTimeout(List.of("semgrep", "bandit")));
        assertEquals(Duration.ofSeconds(20), config.getRunTimeout(List.of()), "Без адаптеров бюджет не нулевой");
    }
    
    @Test
    void unknownAdapterIsRejected() {
        EngineConfig config = EngineConfig.defaults();
        config.setAdapters(List.of("semgrep", "sonarqube"));
        
        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> config.validate(List.of("semgrep", "bandit")));
        assertTrue(error.getMessage().contains("sonarqube"));
    }
    
    @Test
    void badSeverityFloorIsRejected() {
        EngineConfig config = EngineConfig.defaults();
        config.setSeverityFloor("SEVERE");
        
        assertThrows(ConfigurationException.class, config::validateSettings);
    }
    
    @Test
    void nonPositiveAdapterTimeoutIsRejected() {
        EngineConfig config = EngineConfig.defaults();
        EngineConfig.AdapterOptions options = new EngineConfig.AdapterOptions();
        options.setTimeoutSec(0);
        config.getAdapterSettings().put("semgrep", options);
        
        assertThrows(ConfigurationException.class, config::validateSettings);
    }
    
    @Test
    void nonPositiveWorkerCountIsRejected() {
        EngineConfig config = EngineConfig.defaults();
        config.setMaxWorkers(0);
        
        assertThrows(ConfigurationException.class, config::validateSettings);
    }
    
    @Test
    void missingOrBrokenFileIsConfigurationError() throws Exception {
        assertThrows(ConfigurationException.class, () -> EngineConfig.load(temp.resolve("nope.yaml")));
        
        Path broken = temp.resolve("broken.yaml");
        Files.writeString(broken, "adapters: [semgrep\n  - : :");
        assertThrows(ConfigurationException.class, () -> EngineConfig.load(broken));
    }
}
