package com.vtb.triage.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.triage.core.TriageEngineException;
import com.vtb.triage.discovery.ToolDiscovery;
import com.vtb.triage.models.RawFinding;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAST-адаптер Nuclei: проверяет запущенное приложение по targetUrl.
 * Местоположение находки - путь URL, на котором сработал шаблон.
 */
@Slf4j
public class NucleiAdapter implements ScannerAdapter {
    
    public static final String NAME = "nuclei";
    
    private final ToolBinding binding;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();
    
    public NucleiAdapter(ToolDiscovery discovery) {
        this(discovery, new ProcessRunner());
    }
    
    public NucleiAdapter(ToolDiscovery discovery, ProcessRunner runner) {
        this.runner = runner;
        this.binding = new ToolBinding(NAME, discovery, runner);
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public Optional<String> version() {
        return binding.version();
    }
    
    @Override
    public boolean isAvailable() {
        return binding.isAvailable();
    }
    
    @Override
    public List<RawFinding> scan(Path target, AdapterSettings settings) throws TriageEngineException {
        if (settings.getTargetUrl() == null || settings.getTargetUrl().isBlank()) {
            log.warn("nuclei: targetUrl не задан, динамическое сканирование пропущено");
            return List.of();
        }
        
        List<String> command = buildCommand(binding.handle().getPath().toString(), settings);
        ProcessRunner.Result result;
        try {
            result = runner.run(command, settings.getTimeout(), null);
        } catch (AdapterParseException e) {
            log.warn("Вывод nuclei не разобран: {}", e.getMessage());
            return List.of();
        }
        
        if (result.exitCode() != 0 && result.stdout().isBlank()) {
            throw new AdapterExecutionException("nuclei завершился с кодом " + result.exitCode()
                + ": " + SemgrepAdapter.abbreviate(result.stderr()));
        }
        List<RawFinding> findings = parse(result.stdout());
        log.info("nuclei: {} находок для {}", findings.size(), settings.getTargetUrl());
        return findings;
    }
    
    List<String> buildCommand(String executable, AdapterSettings settings) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-u");
        command.add(settings.getTargetUrl());
        command.add("-jsonl");
        command.add("-silent");
        for (String ruleset : settings.getRulesets()) {
            command.add("-t");
            command.add(ruleset);
        }
        command.addAll(settings.getExtraArgs());
        return command;
    }
    
    /**
     * Разобрать JSON Lines. Битые строки пропускаются с предупреждением.
     */
    public List<RawFinding> parse(String stdout) {
        List<RawFinding> findings = new ArrayList<>();
        if (stdout == null || stdout.isBlank()) {
            return findings;
        }
        
        int broken = 0;
        for (String line : stdout.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (IOException e) {
                broken++;
                continue;
            }
            String templateId = SemgrepAdapter.text(node, "template-id");
            String matchedAt = SemgrepAdapter.text(node, "matched-at");
            if (templateId == null || matchedAt == null) {
                broken++;
                continue;
            }
            JsonNode info = node.path("info");
            
            RawFinding.RawFindingBuilder builder = RawFinding.builder()
                .tool(NAME)
                .ruleId(templateId)
                .filePath(endpointOf(matchedAt))
                .line(0)
                .message(info.path("name").asText(templateId))
                .rawSeverity(SemgrepAdapter.text(info, "severity"))
                .categoryHint(SemgrepAdapter.firstValue(info.path("classification").get("cwe-id")))
                .snippet(matchedAt);
            
            JsonNode references = info.get("reference");
            if (references != null && references.isArray()) {
                references.forEach(ref -> builder.reference(ref.asText()));
            }
            findings.add(builder.build());
        }
        if (broken > 0) {
            log.warn("nuclei: пропущено {} некорректных строк вывода", broken);
        }
        return findings;
    }
    
    static String endpointOf(String matchedAt) {
        try {
            URI uri = URI.create(matchedAt.trim());
            String path = uri.getPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            return matchedAt;
        }
    }
    
    @Override
    public String installInstructions() {
        return "Установите nuclei: go install github.com/projectdiscovery/nuclei/v3/cmd/nuclei@latest";
    }
}
