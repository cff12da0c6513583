package com.vtb.triage.discovery;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Локальный кэш загруженных инструментов: {@code <dir>/<name>/<version>/<name>}.
 * 
 * Явный объект вместо глобального состояния. Запись идёт во временный файл
 * в той же директории и затем атомарно переименовывается, поэтому параллельное
 * обнаружение одного инструмента не может повредить кэш.
 */
@Slf4j
public class ToolCache {
    
    /**
     * Запись содержимого во временный файл
     */
    @FunctionalInterface
    public interface ContentWriter {
        void writeTo(Path target) throws IOException;
    }
    
    /**
     * Запись в кэше
     */
    public record CachedTool(String name, String version, Path path, long sizeBytes) {
    }
    
    private final Path root;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    
    public ToolCache(Path root) {
        this.root = root;
    }
    
    public Path getRoot() {
        return root;
    }
    
    public Path entryPath(String name, String version) {
        return root.resolve(name).resolve(version).resolve(name);
    }
    
    public Optional<Path> lookup(String name, String version) {
        Path entry = entryPath(name, version);
        return Executables.isExecutableFile(entry) ? Optional.of(entry) : Optional.empty();
    }
    
    /**
     * Установить инструмент в кэш, если его там ещё нет.
     *
     * @param expectedSha256 ожидаемая контрольная сумма (hex)
     * @throws IOException при ошибке записи или несовпадении контрольной суммы
     */
    public Path install(String name, String version, String expectedSha256, ContentWriter writer) throws IOException {
        String key = name + "@" + version;
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<Path> existing = lookup(name, version);
            if (existing.isPresent()) {
                log.debug("{} уже в кэше: {}", key, existing.get());
                return existing.get();
            }
            
            Path target = entryPath(name, version);
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), name + "-", ".part");
            try {
                writer.writeTo(temp);
                String actual = sha256(temp);
                if (!actual.equalsIgnoreCase(expectedSha256)) {
                    throw new IOException("Контрольная сумма " + key + " не совпала: ожидалось "
                        + expectedSha256 + ", получено " + actual);
                }
                if (!temp.toFile().setExecutable(true, true)) {
                    log.warn("Не удалось выставить флаг исполнения для {}", temp);
                }
                moveIntoPlace(temp, target);
                log.info("{} установлен в кэш: {}", key, target);
                return target;
            } finally {
                Files.deleteIfExists(temp);
            }
        } finally {
            lock.unlock();
        }
    }
    
    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Атомарное переименование недоступно, используем REPLACE_EXISTING");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
    
    /**
     * Список инструментов в кэше
     */
    public List<CachedTool> listCached() throws IOException {
        List<CachedTool> result = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return result;
        }
        try (Stream<Path> tools = Files.list(root)) {
            for (Path toolDir : tools.filter(Files::isDirectory).sorted().toList()) {
                String name = toolDir.getFileName().toString();
                try (Stream<Path> versions = Files.list(toolDir)) {
                    for (Path versionDir : versions.filter(Files::isDirectory).sorted().toList()) {
                        Path binary = versionDir.resolve(name);
                        if (Files.isRegularFile(binary)) {
                            result.add(new CachedTool(name, versionDir.getFileName().toString(),
                                binary, Files.size(binary)));
                        }
                    }
                }
            }
        }
        return result;
    }
    
    public long sizeBytes() throws IOException {
        long total = 0;
        for (CachedTool tool : listCached()) {
            total += tool.sizeBytes();
        }
        return total;
    }
    
    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest()).toLowerCase(Locale.ROOT);
    }
}
