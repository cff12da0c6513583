package com.vtb.triage.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.triage.core.TriageEngineException;
import com.vtb.triage.discovery.ToolDiscovery;
import com.vtb.triage.models.RawFinding;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SAST-адаптер Semgrep.
 * 
 * Коды выхода: 0 - находок нет, 1 - есть находки, 2 и выше - ошибка инструмента.
 */
@Slf4j
public class SemgrepAdapter implements ScannerAdapter {
    
    public static final String NAME = "semgrep";
    private static final String DEFAULT_RULESET = "auto";
    
    private final ToolBinding binding;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();
    
    public SemgrepAdapter(ToolDiscovery discovery) {
        this(discovery, new ProcessRunner());
    }
    
    public SemgrepAdapter(ToolDiscovery discovery, ProcessRunner runner) {
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
        List<String> command = buildCommand(binding.handle().getPath().toString(), target, settings);
        ProcessRunner.Result result;
        try {
            result = runner.run(command, settings.getTimeout(), null);
        } catch (AdapterParseException e) {
            log.warn("Вывод semgrep не разобран: {}", e.getMessage());
            return List.of();
        }
        
        if (result.exitCode() >= 2) {
            throw new AdapterExecutionException("semgrep завершился с кодом " + result.exitCode()
                + ": " + abbreviate(result.stderr()));
        }
        List<RawFinding> findings = parse(result.stdout());
        log.info("semgrep: {} находок", findings.size());
        return findings;
    }
    
    List<String> buildCommand(String executable, Path target, AdapterSettings settings) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        List<String> rulesets = settings.getRulesets().isEmpty() ? List.of(DEFAULT_RULESET) : settings.getRulesets();
        for (String ruleset : rulesets) {
            command.add("--config");
            command.add(ruleset);
        }
        command.add("--json");
        command.add("--quiet");
        for (String glob : settings.getInclude()) {
            command.add("--include");
            command.add(glob);
        }
        for (String glob : settings.getExclude()) {
            command.add("--exclude");
            command.add(glob);
        }
        command.addAll(settings.getExtraArgs());
        command.add(target.toString());
        return command;
    }
    
    /**
     * Разобрать JSON-вывод semgrep. Некорректный вывод даёт пустой список.
     */
    public List<RawFinding> parse(String stdout) {
        List<RawFinding> findings = new ArrayList<>();
        if (stdout == null || stdout.isBlank()) {
            return findings;
        }
        
        JsonNode root;
        try {
            root = mapper.readTree(stdout);
        } catch (IOException e) {
            log.warn("Не удалось разобрать вывод semgrep: {}", e.getMessage());
            return findings;
        }
        
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            log.warn("В выводе semgrep нет массива results");
            return findings;
        }
        
        for (JsonNode result : results) {
            String path = text(result, "path");
            String checkId = text(result, "check_id");
            if (path == null || checkId == null) {
                log.debug("Пропуск результата semgrep без path/check_id");
                continue;
            }
            JsonNode extra = result.path("extra");
            JsonNode metadata = extra.path("metadata");
            
            RawFinding.RawFindingBuilder builder = RawFinding.builder()
                .tool(NAME)
                .ruleId(checkId)
                .filePath(path)
                .line(result.path("start").path("line").asInt(0))
                .endLine(intOrNull(result.path("end").path("line")))
                .column(intOrNull(result.path("start").path("col")))
                .message(extra.path("message").asText(""))
                .rawSeverity(text(extra, "severity"))
                .snippet(snippet(extra.path("lines").asText(null)))
                .categoryHint(firstValue(metadata.get("cwe")))
                .rawConfidence(text(metadata, "confidence"));
            
            JsonNode references = metadata.get("references");
            if (references != null && references.isArray()) {
                references.forEach(ref -> builder.reference(ref.asText()));
            }
            findings.add(builder.build());
        }
        return findings;
    }
    
    @Override
    public String installInstructions() {
        return "Установите semgrep: pip install semgrep (или brew install semgrep)";
    }
    
    // "requires login" вместо кода в бесплатной версии не является фрагментом
    private static String snippet(String lines) {
        if (lines == null || lines.isBlank() || "requires login".equals(lines.trim())) {
            return null;
        }
        return lines;
    }
    
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
    
    static Integer intOrNull(JsonNode node) {
        return node != null && node.canConvertToInt() ? node.asInt() : null;
    }
    
    static String firstValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.size() > 0 ? node.get(0).asText() : null;
        }
        return node.asText();
    }
    
    static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() > 300 ? trimmed.substring(0, 300) + "..." : trimmed;
    }
}
