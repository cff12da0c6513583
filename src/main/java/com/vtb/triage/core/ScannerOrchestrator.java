package com.vtb.triage.core;

import com.vtb.triage.adapters.AdapterSettings;
import com.vtb.triage.adapters.AdapterTimeoutException;
import com.vtb.triage.adapters.ScannerAdapter;
import com.vtb.triage.config.ConfigurationException;
import com.vtb.triage.config.EngineConfig;
import com.vtb.triage.models.AdapterOutcome;
import com.vtb.triage.models.AdapterStatus;
import com.vtb.triage.models.OrchestrationResult;
import com.vtb.triage.models.RawFinding;
import com.vtb.triage.models.Severity;
import com.vtb.triage.models.UnifiedFinding;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Параллельный запуск адаптеров, нормализация и дедупликация.
 * 
 * Адаптеры работают на ограниченном пуле потоков, каждый в своём бюджете времени.
 * Упавший или зависший адаптер не прерывает остальные: результат будет частичным,
 * а причина попадёт в учёт (outcomes).
 */
@Slf4j
public class ScannerOrchestrator {
    
    private static final long POLL_INTERVAL_MS = 50;
    
    private final Map<String, ScannerAdapter> registered = new LinkedHashMap<>();
    
    public ScannerOrchestrator() {
    }
    
    public ScannerOrchestrator(Collection<? extends ScannerAdapter> adapters) {
        adapters.forEach(this::register);
    }
    
    /**
     * @throws IllegalArgumentException если адаптер с таким именем уже зарегистрирован
     */
    public void register(ScannerAdapter adapter) {
        if (registered.containsKey(adapter.name())) {
            throw new IllegalArgumentException("Адаптер уже зарегистрирован: " + adapter.name());
        }
        registered.put(adapter.name(), adapter);
    }
    
    public List<String> listAdapters() {
        return new ArrayList<>(registered.keySet());
    }
    
    public Optional<ScannerAdapter> adapter(String name) {
        return Optional.ofNullable(registered.get(name));
    }
    
    /**
     * Запустить адаптеры из config.adapters (в порядке конфигурации)
     */
    public OrchestrationResult run(Path target, EngineConfig config) {
        config.validate(registered.keySet());
        List<ScannerAdapter> selected = new ArrayList<>();
        for (String name : config.getAdapters()) {
            selected.add(registered.get(name));
        }
        return execute(target, selected, config);
    }
    
    /**
     * Запустить явно переданные адаптеры. Порядок списка определяет порядок слияния.
     *
     * @throws ConfigurationException при ошибке конфигурации или цели, до запуска адаптеров
     */
    public OrchestrationResult run(Path target, List<? extends ScannerAdapter> adapters, EngineConfig config) {
        config.validateSettings();
        Set<String> names = new HashSet<>();
        for (ScannerAdapter adapter : adapters) {
            if (!names.add(adapter.name())) {
                throw new ConfigurationException("Адаптер указан дважды: " + adapter.name());
            }
        }
        return execute(target, new ArrayList<>(adapters), config);
    }
    
    private OrchestrationResult execute(Path target, List<ScannerAdapter> adapters, EngineConfig config) {
        if (target == null || !Files.exists(target)) {
            throw new ConfigurationException("Цель сканирования не существует: " + target);
        }
        long start = System.currentTimeMillis();
        Severity floor = config.getSeverityFloorLevel();
        
        Map<String, AdapterOutcome> outcomes = new LinkedHashMap<>();
        List<ScannerAdapter> runnable = new ArrayList<>();
        for (ScannerAdapter adapter : adapters) {
            if (isAvailable(adapter)) {
                runnable.add(adapter);
            } else {
                log.warn("{} недоступен, пропускаем. {}", adapter.name(), adapter.installInstructions());
                outcomes.put(adapter.name(), AdapterOutcome.skipped(adapter.name(), adapter.installInstructions()));
            }
        }
        
        Map<String, List<RawFinding>> rawByAdapter = runAll(target, runnable, config, outcomes);
        
        // Слияние строго в порядке конфигурации, независимо от порядка завершения
        FindingNormalizer normalizer = new FindingNormalizer(
            new CategoryMapper(config.getCategoryMapping()),
            new FingerprintCalculator(config.getFingerprint().getLineBucketSize()),
            target);
        PathFilter filter = new PathFilter(config.getInclude(), config.getExclude());
        FindingMerger merger = new FindingMerger(config.getFingerprint().getLineTolerance());
        int filtered = 0;
        
        for (ScannerAdapter adapter : adapters) {
            List<RawFinding> raw = rawByAdapter.get(adapter.name());
            if (raw == null) {
                continue;
            }
            for (RawFinding finding : raw) {
                UnifiedFinding unified;
                try {
                    unified = normalizer.normalize(finding);
                } catch (RuntimeException e) {
                    log.warn("Находка {} от {} не нормализована: {}", finding.getRuleId(), adapter.name(), e.getMessage());
                    continue;
                }
                if (!filter.accepts(unified.getLocation().getFile()) || !unified.getSeverity().isAtLeast(floor)) {
                    filtered++;
                    continue;
                }
                merger.add(unified);
            }
        }
        
        List<UnifiedFinding> findings = merger.findings();
        long duration = System.currentTimeMillis() - start;
        log.info("Оркестрация завершена за {} мс: {} уникальных находок, отфильтровано {}",
            duration, findings.size(), filtered);
        
        List<AdapterOutcome> ordered = new ArrayList<>();
        for (ScannerAdapter adapter : adapters) {
            ordered.add(outcomes.get(adapter.name()));
        }
        return OrchestrationResult.builder()
            .findings(findings)
            .outcomes(ordered)
            .durationMs(duration)
            .build();
    }
    
    private Map<String, List<RawFinding>> runAll(Path target, List<ScannerAdapter> runnable,
                                                 EngineConfig config, Map<String, AdapterOutcome> outcomes) {
        Map<String, List<RawFinding>> results = new LinkedHashMap<>();
        if (runnable.isEmpty()) {
            return results;
        }
        
        int workers = Math.min(runnable.size(), config.getMaxWorkers());
        ExecutorService executor = Executors.newFixedThreadPool(workers, daemonThreads());
        Map<String, Long> startedAt = new ConcurrentHashMap<>();
        Map<String, Future<List<RawFinding>>> pending = new LinkedHashMap<>();
        Map<String, Duration> timeouts = new LinkedHashMap<>();
        
        try {
            for (ScannerAdapter adapter : runnable) {
                AdapterSettings settings = settingsFor(adapter.name(), config);
                timeouts.put(adapter.name(), settings.getTimeout());
                pending.put(adapter.name(), executor.submit(() -> {
                    startedAt.put(adapter.name(), System.currentTimeMillis());
                    log.debug("Запуск адаптера: {}", adapter.name());
                    List<RawFinding> found = adapter.scan(target, settings);
                    return found != null ? found : List.of();
                }));
            }
            
            long deadline = System.currentTimeMillis() + config.getRunTimeout(timeouts.keySet()).toMillis();
            
            while (!pending.isEmpty()) {
                long now = System.currentTimeMillis();
                var iterator = pending.entrySet().iterator();
                while (iterator.hasNext()) {
                    var entry = iterator.next();
                    String name = entry.getKey();
                    Future<List<RawFinding>> future = entry.getValue();
                    Long started = startedAt.get(name);
                    long elapsed = started != null ? now - started : 0;
                    
                    if (future.isDone()) {
                        collect(name, future, elapsed, results, outcomes);
                        iterator.remove();
                    } else if (started != null && elapsed > timeouts.get(name).toMillis()) {
                        future.cancel(true);
                        log.warn("{} превысил тайм-аут {} с, задача отменена", name, timeouts.get(name).toSeconds());
                        outcomes.put(name, outcome(name, AdapterStatus.TIMED_OUT,
                            "Превышен тайм-аут " + timeouts.get(name).toSeconds() + " с", 0, elapsed));
                        iterator.remove();
                    } else if (now >= deadline) {
                        future.cancel(true);
                        log.warn("{} отменён: исчерпан общий бюджет запуска", name);
                        outcomes.put(name, outcome(name, AdapterStatus.TIMED_OUT,
                            "Исчерпан общий бюджет запуска", 0, elapsed));
                        iterator.remove();
                    }
                }
                if (!pending.isEmpty()) {
                    TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Оркестрация прервана, отменяем {} адаптеров", pending.size());
            for (Map.Entry<String, Future<List<RawFinding>>> entry : pending.entrySet()) {
                entry.getValue().cancel(true);
                outcomes.put(entry.getKey(), outcome(entry.getKey(), AdapterStatus.FAILED, "Оркестрация прервана", 0, 0));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }
    
    private static void collect(String name, Future<List<RawFinding>> future, long elapsed,
                                Map<String, List<RawFinding>> results, Map<String, AdapterOutcome> outcomes)
            throws InterruptedException {
        try {
            List<RawFinding> found = future.get();
            results.put(name, found);
            outcomes.put(name, outcome(name, AdapterStatus.SUCCEEDED, null, found.size(), elapsed));
            log.info("{} завершён за {} мс, находок: {}", name, elapsed, found.size());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            AdapterStatus status = cause instanceof AdapterTimeoutException ? AdapterStatus.TIMED_OUT : AdapterStatus.FAILED;
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.error("Ошибка адаптера {}: {}", name, reason, cause);
            outcomes.put(name, outcome(name, status, reason, 0, elapsed));
        } catch (CancellationException e) {
            outcomes.put(name, outcome(name, AdapterStatus.TIMED_OUT, "Задача отменена", 0, elapsed));
        }
    }
    
    private static boolean isAvailable(ScannerAdapter adapter) {
        try {
            return adapter.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Проверка доступности {} упала: {}", adapter.name(), e.getMessage());
            return false;
        }
    }
    
    static AdapterSettings settingsFor(String name, EngineConfig config) {
        EngineConfig.AdapterOptions options = config.optionsFor(name);
        AdapterSettings.AdapterSettingsBuilder builder = AdapterSettings.builder()
            .timeout(config.getAdapterTimeout(name))
            .include(config.getInclude())
            .exclude(config.getExclude())
            .targetUrl(options.getTargetUrl());
        if (options.getRulesets() != null) {
            builder.rulesets(options.getRulesets());
        }
        if (options.getExtraArgs() != null) {
            builder.extraArgs(options.getExtraArgs());
        }
        return builder.build();
    }
    
    private static AdapterOutcome outcome(String name, AdapterStatus status, String reason, int count, long durationMs) {
        return AdapterOutcome.builder()
            .adapter(name)
            .status(status)
            .reason(reason)
            .findingCount(count)
            .durationMs(durationMs)
            .build();
    }
    
    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "scanner-adapter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
