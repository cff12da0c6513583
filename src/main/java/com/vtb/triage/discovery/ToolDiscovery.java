package com.vtb.triage.discovery;

import com.vtb.triage.config.EngineConfig;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Поиск исполняемого файла сканера по цепочке стратегий:
 * системный PATH -> установка в проекте -> версионированный кэш с загрузкой.
 * 
 * Побеждает первая успешная стратегия. Результаты кэшируются на время жизни объекта.
 */
@Slf4j
public class ToolDiscovery {
    
    private final List<LocationStrategy> strategies;
    private final Map<String, ToolHandle> located = new ConcurrentHashMap<>();
    private final Map<String, Boolean> availability = new ConcurrentHashMap<>();
    
    public ToolDiscovery(List<LocationStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }
    
    /**
     * Стандартная цепочка по конфигурации
     */
    public static ToolDiscovery create(EngineConfig config, Path projectRoot) {
        ToolCache cache = new ToolCache(Paths.get(config.getCacheDir()));
        ToolDownloader downloader = new ToolDownloader(Duration.ofSeconds(config.getDiscoveryTimeoutSec()));
        return new ToolDiscovery(List.of(
            new SystemPathStrategy(),
            new ProjectLocalStrategy(projectRoot),
            new CacheDownloadStrategy(cache, downloader, config.getTools(), Boolean.TRUE.equals(config.getOffline()))
        ));
    }
    
    /**
     * Найти инструмент.
     *
     * @throws ToolNotFoundException если ни одна стратегия не нашла инструмент
     */
    public ToolHandle locate(String toolName) throws ToolNotFoundException {
        ToolHandle cached = located.get(toolName);
        if (cached != null) {
            return cached;
        }
        
        List<String> checked = new ArrayList<>();
        for (LocationStrategy strategy : strategies) {
            Optional<ToolHandle> handle = strategy.find(toolName, checked);
            if (handle.isPresent()) {
                log.debug("{} найден стратегией {}: {}", toolName, strategy.name(), handle.get().getPath());
                located.put(toolName, handle.get());
                availability.put(toolName, Boolean.TRUE);
                return handle.get();
            }
        }
        availability.put(toolName, Boolean.FALSE);
        throw new ToolNotFoundException(toolName, checked);
    }
    
    public boolean isAvailable(String toolName) {
        Boolean known = availability.get(toolName);
        if (known != null) {
            return known;
        }
        try {
            locate(toolName);
            return true;
        } catch (ToolNotFoundException e) {
            log.debug(e.getMessage());
            return false;
        }
    }
}
