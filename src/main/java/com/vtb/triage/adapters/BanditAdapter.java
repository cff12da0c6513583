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
 * SAST-адаптер Bandit (Python).
 * Bandit не умеет include-фильтры, их применяет оркестратор после нормализации.
 */
@Slf4j
public class BanditAdapter implements ScannerAdapter {
    
    public static final String NAME = "bandit";
    
    private final ToolBinding binding;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();
    
    public BanditAdapter(ToolDiscovery discovery) {
        this(discovery, new ProcessRunner());
    }
    
    public BanditAdapter(ToolDiscovery discovery, ProcessRunner runner) {
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
            log.warn("Вывод bandit не разобран: {}", e.getMessage());
            return List.of();
        }
        
        // 1 означает "есть находки", как и у semgrep
        if (result.exitCode() >= 2) {
            throw new AdapterExecutionException("bandit завершился с кодом " + result.exitCode()
                + ": " + SemgrepAdapter.abbreviate(result.stderr()));
        }
        List<RawFinding> findings = parse(result.stdout());
        log.info("bandit: {} находок", findings.size());
        return findings;
    }
    
    List<String> buildCommand(String executable, Path target, AdapterSettings settings) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-r");
        command.add("-f");
        command.add("json");
        command.add("-q");
        if (!settings.getExclude().isEmpty()) {
            command.add("-x");
            command.add(String.join(",", settings.getExclude()));
        }
        command.addAll(settings.getExtraArgs());
        command.add(target.toString());
        return command;
    }
    
    /**
     * Разобрать JSON-отчёт bandit. Некорректный вывод даёт пустой список.
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
            log.warn("Не удалось разобрать вывод bandit: {}", e.getMessage());
            return findings;
        }
        
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            log.warn("В выводе bandit нет массива results");
            return findings;
        }
        
        for (JsonNode result : results) {
            String filename = SemgrepAdapter.text(result, "filename");
            String testId = SemgrepAdapter.text(result, "test_id");
            if (filename == null || testId == null) {
                continue;
            }
            int line = result.path("line_number").asInt(0);
            JsonNode range = result.get("line_range");
            Integer endLine = range != null && range.isArray() && range.size() > 0
                ? range.get(range.size() - 1).asInt()
                : null;
            JsonNode cwe = result.path("issue_cwe").get("id");
            
            RawFinding.RawFindingBuilder builder = RawFinding.builder()
                .tool(NAME)
                .ruleId(testId)
                .filePath(filename)
                .line(line)
                .endLine(endLine)
                .column(SemgrepAdapter.intOrNull(result.get("col_offset")))
                .message(result.path("issue_text").asText(""))
                .rawSeverity(SemgrepAdapter.text(result, "issue_severity"))
                .rawConfidence(SemgrepAdapter.text(result, "issue_confidence"))
                .categoryHint(cwe != null && !cwe.isNull() ? "CWE-" + cwe.asText() : null)
                .snippet(reportedLine(result.path("code").asText(null), line));
            
            String moreInfo = SemgrepAdapter.text(result, "more_info");
            if (moreInfo != null) {
                builder.reference(moreInfo);
            }
            findings.add(builder.build());
        }
        return findings;
    }
    
    /**
     * В поле code bandit отдаёт несколько строк вида "42 cursor.execute(q)".
     * Для якоря fingerprint нужна только строка находки.
     */
    static String reportedLine(String code, int line) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String prefix = line + " ";
        for (String codeLine : code.split("\\R")) {
            if (codeLine.startsWith(prefix)) {
                return codeLine.substring(prefix.length());
            }
        }
        return code;
    }
    
    @Override
    public String installInstructions() {
        return "Установите bandit: pip install bandit";
    }
}
