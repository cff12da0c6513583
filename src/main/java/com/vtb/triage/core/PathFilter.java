package com.vtb.triage.core;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * include/exclude по glob для нормализованных путей.
 * Шаблон "**&#47;x" совпадает и с файлом x в корне.
 */
public class PathFilter {
    
    private final List<PathMatcher> include;
    private final List<PathMatcher> exclude;
    
    public PathFilter(List<String> include, List<String> exclude) {
        this.include = compile(include);
        this.exclude = compile(exclude);
    }
    
    public boolean accepts(String normalizedPath) {
        Path path;
        try {
            path = Paths.get(normalizedPath);
        } catch (InvalidPathException e) {
            return include.isEmpty();
        }
        if (!include.isEmpty() && include.stream().noneMatch(m -> m.matches(path))) {
            return false;
        }
        return exclude.stream().noneMatch(m -> m.matches(path));
    }
    
    private static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (globs == null) {
            return matchers;
        }
        for (String glob : globs) {
            if (glob == null || glob.isBlank()) {
                continue;
            }
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }
}
