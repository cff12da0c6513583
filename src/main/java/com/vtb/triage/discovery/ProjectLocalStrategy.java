package com.vtb.triage.discovery;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Стратегия 2: установка внутри проекта (virtualenv, node_modules, локальный toolchain)
 */
public class ProjectLocalStrategy implements LocationStrategy {
    
    private static final List<String> LOCAL_BIN_DIRS = List.of(
        ".venv/bin",
        "venv/bin",
        ".venv/Scripts",
        "venv/Scripts",
        "node_modules/.bin",
        ".tools/bin"
    );
    
    private final Path projectRoot;
    
    public ProjectLocalStrategy(Path projectRoot) {
        this.projectRoot = projectRoot;
    }
    
    @Override
    public String name() {
        return "project-local";
    }
    
    @Override
    public Optional<ToolHandle> find(String toolName, List<String> checked) {
        if (projectRoot == null) {
            return Optional.empty();
        }
        for (String binDir : LOCAL_BIN_DIRS) {
            Path dir = projectRoot.resolve(binDir);
            checked.add(dir.toString());
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
