package com.vtb.triage.adapters;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {
    
    private final ProcessRunner runner = new ProcessRunner();
    
    @Test
    void capturesBothStreamsAndExitCode() throws Exception {
        ProcessRunner.Result result = runner.run(
            List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10), null);
        
        assertEquals(3, result.exitCode());
        assertEquals("out", result.stdout().strip());
        assertEquals("err", result.stderr().strip());
    }
    
    @Test
    void timeoutKillsProcess() {
        long start = System.currentTimeMillis();
        
        assertThrows(AdapterTimeoutException.class,
            () -> runner.run(List.of("sh", "-c", "sleep 30"), Duration.ofMillis(500), null));
        
        assertTrue(System.currentTimeMillis() - start < 10_000, "Процесс должен быть убит по тайм-ауту");
    }
    
    @Test
    void stdoutHeldByBackgroundChildIsParseError() {
        ProcessRunner quick = new ProcessRunner(Duration.ofMillis(300));
        
        AdapterParseException error = assertThrows(AdapterParseException.class,
            () -> quick.run(List.of("sh", "-c", "echo '{\"results\": ['; sleep 3 & exit 0"),
                Duration.ofSeconds(10), null));
        assertTrue(error.getMessage().contains("обрезан"));
    }
    
    @Test
    void missingExecutableIsExecutionError() {
        assertThrows(AdapterExecutionException.class,
            () -> runner.run(List.of("/nonexistent/tool-binary"), Duration.ofSeconds(5), null));
    }
    
    @Test
    void largeOutputDoesNotBlock() throws Exception {
        ProcessRunner.Result result = runner.run(
            List.of("sh", "-c", "i=0; while [ $i -lt 20000 ]; do echo line-$i; echo err-$i 1>&2; i=$((i+1)); done"),
            Duration.ofSeconds(30), null);
        
        assertEquals(0, result.exitCode());
        assertEquals(20000, result.stdout().lines().count());
        assertEquals(20000, result.stderr().lines().count());
    }
}
