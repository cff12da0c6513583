package com.vtb.triage.discovery;

import com.vtb.triage.config.EngineConfig.ToolSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Стратегия 3: версионированная копия в локальном кэше, при необходимости
 * загружается и проверяется по SHA-256 перед первым использованием.
 * Пишет в кэш только эта стратегия.
 */
@Slf4j
public class CacheDownloadStrategy implements LocationStrategy {
    
    private final ToolCache cache;
    private final ToolDownloader downloader;
    private final Map<String, ToolSpec> specs;
    private final boolean offline;
    
    public CacheDownloadStrategy(ToolCache cache, ToolDownloader downloader,
                                 Map<String, ToolSpec> specs, boolean offline) {
        this.cache = cache;
        this.downloader = downloader;
        this.specs = specs != null ? specs : Map.of();
        this.offline = offline;
    }
    
    @Override
    public String name() {
        return "cache-download";
    }
    
    @Override
    public Optional<ToolHandle> find(String toolName, List<String> checked) {
        ToolSpec spec = specs.get(toolName);
        if (spec == null || spec.getVersion() == null) {
            checked.add("cache (нет описания загрузки для " + toolName + ")");
            return Optional.empty();
        }
        
        String version = spec.getVersion();
        checked.add(cache.entryPath(toolName, version).toString());
        Optional<Path> cached = cache.lookup(toolName, version);
        if (cached.isPresent()) {
            return Optional.of(handle(toolName, version, cached.get()));
        }
        
        if (offline) {
            log.debug("Офлайн-режим: загрузка {} пропущена", toolName);
            return Optional.empty();
        }
        if (spec.getSha256() == null || spec.getSha256().isBlank()) {
            log.warn("Для {} не задана контрольная сумма, загрузка запрещена", toolName);
            return Optional.empty();
        }
        String url = resolveUrl(spec);
        if (url == null) {
            log.warn("Для {} нет URL под платформу {}", toolName, platformKey());
            return Optional.empty();
        }
        
        checked.add(url);
        try {
            Path installed = cache.install(toolName, version, spec.getSha256(),
                temp -> downloader.download(url, temp));
            return Optional.of(handle(toolName, version, installed));
        } catch (IOException e) {
            log.warn("Не удалось загрузить {} {}: {}", toolName, version, e.getMessage());
            return Optional.empty();
        }
    }
    
    private ToolHandle handle(String toolName, String version, Path path) {
        return ToolHandle.builder()
            .name(toolName)
            .version(version)
            .path(path)
            .foundBy(name())
            .build();
    }
    
    private static String resolveUrl(ToolSpec spec) {
        if (spec.getUrls() == null) {
            return null;
        }
        String template = spec.getUrls().get(platformKey());
        if (template == null) {
            template = spec.getUrls().get("any");
        }
        return template != null ? template.replace("{version}", spec.getVersion()) : null;
    }
    
    static String platformKey() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) return "windows";
        if (os.contains("mac") || os.contains("darwin")) return "mac";
        return "linux";
    }
}
