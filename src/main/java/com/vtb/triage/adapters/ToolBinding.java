package com.vtb.triage.adapters;

import com.vtb.triage.discovery.ToolDiscovery;
import com.vtb.triage.discovery.ToolHandle;
import com.vtb.triage.discovery.ToolNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Связка адаптера с обнаружением инструмента: поиск, доступность и версия
 */
@Slf4j
public class ToolBinding {
    
    private static final Pattern VERSION_PATTERN = Pattern.compile("v?(\\d+\\.\\d+(?:\\.\\d+)?(?:-[\\w.]+)?)");
    
    private final String toolName;
    private final ToolDiscovery discovery;
    private final ProcessRunner runner;
    private volatile String cachedVersion;
    
    public ToolBinding(String toolName, ToolDiscovery discovery, ProcessRunner runner) {
        this.toolName = toolName;
        this.discovery = discovery;
        this.runner = runner;
    }
    
    public String getToolName() {
        return toolName;
    }
    
    public boolean isAvailable() {
        return discovery.isAvailable(toolName);
    }
    
    public ToolHandle handle() throws ToolNotFoundException {
        return discovery.locate(toolName);
    }
    
    /**
     * Версия из вывода {@code <tool> --version}, вычисляется один раз
     */
    public Optional<String> version() {
        if (cachedVersion != null) {
            return Optional.of(cachedVersion);
        }
        try {
            ToolHandle handle = handle();
            if (handle.getVersion() != null) {
                cachedVersion = handle.getVersion();
                return Optional.of(cachedVersion);
            }
            ProcessRunner.Result result = runner.run(
                List.of(handle.getPath().toString(), "--version"), Duration.ofSeconds(10), null);
            Matcher matcher = VERSION_PATTERN.matcher(result.stdout() + " " + result.stderr());
            if (matcher.find()) {
                cachedVersion = matcher.group(1);
                return Optional.of(cachedVersion);
            }
        } catch (Exception e) {
            log.debug("Версия {} не определена: {}", toolName, e.getMessage());
        }
        return Optional.empty();
    }
}
