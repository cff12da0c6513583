package com.vtb.triage.discovery;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Стратегия 1: исполняемый файл в системном PATH
 */
@Slf4j
public class SystemPathStrategy implements LocationStrategy {
    
    private final String pathVariable;
    
    public SystemPathStrategy() {
        this(System.getenv("PATH"));
    }
    
    public SystemPathStrategy(String pathVariable) {
        this.pathVariable = pathVariable != null ? pathVariable : "";
    }
    
    @Override
    public String name() {
        return "system-path";
    }
    
    @Override
    public Optional<ToolHandle> find(String toolName, List<String> checked) {
        checked.add("PATH");
        for (String entry : pathVariable.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            Path dir;
            try {
                dir = Paths.get(entry);
            } catch (InvalidPathException e) {
                log.debug("Пропускаем некорректный элемент PATH: {}", entry);
                continue;
            }
            for (String candidateName : Executables.candidateNames(toolName)) {
                Path candidate = dir.resolve(candidateName);
                if (Executables.isExecutableFile(candidate)) {
                    return Optional.of(ToolHandle.builder()
                        .name(toolName)
                        .path(candidate.toAbsolutePath())
                        .foundBy(name())
                        .build());
                }
            }
        }
        return Optional.empty();
    }
}
