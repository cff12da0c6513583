package com.vtb.triage.core;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Стабильный идентификатор находки.
 * 
 * fingerprint = первые 16 hex-символов SHA-256 от "путь|категория|якорь".
 * Якорь - значимая строка кода, поэтому fingerprint не меняется при сдвиге строк
 * и совпадает у разных сканеров, указавших на одно и то же место.
 */
@Slf4j
public class FingerprintCalculator {
    
    private static final int FINGERPRINT_LENGTH = 16;
    private static final Pattern LINE_NUMBER_PREFIX = Pattern.compile("^\\s*\\d+(?:\\s*[:|]\\s*|\\s+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> COMMENT_PREFIXES = List.of("#", "//", "/*", "*", "--", "<!--");
    
    private final int lineBucketSize;
    private final Map<Path, List<String>> sourceCache = new ConcurrentHashMap<>();
    
    public FingerprintCalculator(int lineBucketSize) {
        this.lineBucketSize = lineBucketSize > 0 ? lineBucketSize : 10;
    }
    
    /**
     * @param normalizedPath путь из {@link #normalizePath(String, Path)}
     * @param root           корень цели, из него читается строка, если фрагмента нет
     */
    public String fingerprint(String normalizedPath, String category, String snippet, int line, Path root) {
        String anchor = anchorFromSnippet(snippet);
        if (anchor == null) {
            anchor = anchorFromSource(root, normalizedPath, line);
        }
        if (anchor == null) {
            anchor = "L" + (Math.max(line, 0) / lineBucketSize);
        }
        return hash(normalizedPath + "|" + category + "|" + anchor);
    }
    
    /**
     * Самая длинная значимая строка фрагмента без номеров строк, комментариев и пробелов
     */
    static String anchorFromSnippet(String snippet) {
        if (snippet == null || snippet.isBlank()) {
            return null;
        }
        String best = null;
        for (String raw : snippet.split("\\R")) {
            String candidate = significant(LINE_NUMBER_PREFIX.matcher(raw).replaceFirst(""));
            if (candidate != null && (best == null || candidate.length() > best.length())) {
                best = candidate;
            }
        }
        return best;
    }
    
    private String anchorFromSource(Path root, String normalizedPath, int line) {
        if (root == null || line <= 0) {
            return null;
        }
        Path file;
        try {
            file = root.resolve(normalizedPath).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            return null;
        }
        List<String> lines;
        try {
            lines = sourceCache.computeIfAbsent(file, FingerprintCalculator::readLines);
        } catch (UncheckedIOException e) {
            log.debug("Не удалось прочитать {}: {}", file, e.getMessage());
            return null;
        }
        for (int i = line - 1; i < lines.size(); i++) {
            String candidate = significant(lines.get(i));
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
    
    private static List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    private static String significant(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        for (String prefix : COMMENT_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return null;
            }
        }
        return WHITESPACE.matcher(trimmed).replaceAll("");
    }
    
    /**
     * Путь относительно корня цели, через "/", без ведущего "./"
     */
    public static String normalizePath(String filePath, Path root) {
        if (filePath == null || filePath.isBlank()) {
            return "";
        }
        String unified = filePath.trim().replace('\\', '/');
        String result = unified;
        try {
            Path path = Paths.get(unified);
            if (root != null) {
                Path absoluteRoot = root.toAbsolutePath().normalize();
                Path absolute = path.isAbsolute()
                    ? path.normalize()
                    : Paths.get("").toAbsolutePath().resolve(path).normalize();
                if (absolute.startsWith(absoluteRoot) && !absolute.equals(absoluteRoot)) {
                    result = absoluteRoot.relativize(absolute).toString();
                } else {
                    result = path.normalize().toString();
                }
            } else {
                result = path.normalize().toString();
            }
        } catch (InvalidPathException e) {
            log.debug("Путь не разобран, используется как есть: {}", filePath);
        }
        result = result.replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }
    
    static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }
}
