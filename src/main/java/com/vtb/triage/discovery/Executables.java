package com.vtb.triage.discovery;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Утилиты проверки исполняемых файлов с учётом Windows
 */
final class Executables {
    
    private static final boolean WINDOWS = System.getProperty("os.name", "")
        .toLowerCase(Locale.ROOT).contains("win");
    
    private Executables() {
    }
    
    static boolean isWindows() {
        return WINDOWS;
    }
    
    /**
     * Кандидаты имён файла: на Windows добавляются расширения из PATHEXT
     */
    static List<String> candidateNames(String toolName) {
        if (!WINDOWS) {
            return List.of(toolName);
        }
        String pathExt = System.getenv("PATHEXT");
        String[] extensions = (pathExt != null ? pathExt : ".EXE;.BAT;.CMD").split(";");
        List<String> names = new java.util.ArrayList<>();
        names.add(toolName);
        for (String ext : extensions) {
            if (!ext.isBlank()) {
                names.add(toolName + ext.toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }
    
    static boolean isExecutableFile(Path candidate) {
        return Files.isRegularFile(candidate) && (WINDOWS || Files.isExecutable(candidate));
    }
}
