package com.vtb.triage.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.triage.models.Severity;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация движка оркестрации и триажа.
 * Загружается из YAML (classpath: triage-config.yaml или явный файл),
 * недостающие значения заполняются в {@link #ensureDefaults()}.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    
    public static final String DEFAULT_RESOURCE = "triage-config.yaml";
    
    private static final int DEFAULT_ADAPTER_TIMEOUT_SEC = 300;
    private static final int DEFAULT_MAX_WORKERS = 4;
    private static final int DEFAULT_DISCOVERY_TIMEOUT_SEC = 120;
    private static final List<String> DEFAULT_ADAPTERS = List.of("semgrep", "bandit");
    
    private List<String> adapters;
    private Integer adapterTimeoutSec;
    /** Общий бюджет запуска; по умолчанию сумма тайм-аутов адаптеров */
    private Integer runTimeoutSec;
    private Integer maxWorkers;
    private List<String> include;
    private List<String> exclude;
    private String severityFloor;
    
    private String cacheDir;
    private Boolean offline;
    private Integer discoveryTimeoutSec;
    private Map<String, ToolSpec> tools;
    
    private Map<String, AdapterOptions> adapterSettings;
    private Fingerprint fingerprint;
    private Triage triage;
    private RiskTables riskTables;
    /** Ключевое слово в rule id / сообщении -> CWE, порядок важен */
    private Map<String, String> categoryMapping;
    
    /**
     * Загрузить конфигурацию по умолчанию из classpath
     */
    public static EngineConfig load() {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.warn("{} не найден в classpath, используются значения по умолчанию", DEFAULT_RESOURCE);
                return defaults();
            }
            EngineConfig config = yamlMapper().readValue(is, EngineConfig.class);
            config.ensureDefaults();
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }
    
    /**
     * Загрузить конфигурацию из файла
     */
    public static EngineConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Файл конфигурации не найден: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            EngineConfig config = yamlMapper().readValue(is, EngineConfig.class);
            if (config == null) {
                config = new EngineConfig();
            }
            config.ensureDefaults();
            log.info("Конфигурация загружена: {}", file);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Ошибка разбора " + file + ": " + e.getMessage(), e);
        }
    }
    
    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.ensureDefaults();
        return config;
    }
    
    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory());
    }
    
    public void ensureDefaults() {
        if (adapters == null) {
            adapters = new ArrayList<>(DEFAULT_ADAPTERS);
        }
        if (adapterTimeoutSec == null) {
            adapterTimeoutSec = DEFAULT_ADAPTER_TIMEOUT_SEC;
        }
        if (maxWorkers == null) {
            maxWorkers = DEFAULT_MAX_WORKERS;
        }
        if (include == null) {
            include = new ArrayList<>();
        }
        if (exclude == null) {
            exclude = new ArrayList<>();
        }
        if (severityFloor == null || severityFloor.isBlank()) {
            severityFloor = Severity.INFO.name();
        }
        if (cacheDir == null || cacheDir.isBlank()) {
            cacheDir = Paths.get(System.getProperty("user.home"), ".vtb-triage", "tools").toString();
        }
        if (offline == null) {
            offline = Boolean.FALSE;
        }
        if (discoveryTimeoutSec == null || discoveryTimeoutSec <= 0) {
            discoveryTimeoutSec = DEFAULT_DISCOVERY_TIMEOUT_SEC;
        }
        if (tools == null) {
            tools = new HashMap<>();
        }
        if (adapterSettings == null) {
            adapterSettings = new HashMap<>();
        }
        if (fingerprint == null) {
            fingerprint = new Fingerprint();
        }
        fingerprint.ensureDefaults();
        if (triage == null) {
            triage = new Triage();
        }
        triage.ensureDefaults();
        if (riskTables == null) {
            riskTables = new RiskTables();
        }
        riskTables.ensureDefaults();
        if (categoryMapping == null || categoryMapping.isEmpty()) {
            categoryMapping = defaultCategoryMapping();
        }
    }
    
    /**
     * Проверить конфигурацию до начала работы.
     *
     * @param knownAdapters имена зарегистрированных адаптеров
     * @throws ConfigurationException при любой ошибке
     */
    public void validate(Collection<String> knownAdapters) {
        validateSettings();
        for (String name : adapters) {
            if (name == null || !knownAdapters.contains(name)) {
                throw new ConfigurationException("Неизвестный адаптер в конфигурации: " + name
                    + " (доступны: " + knownAdapters + ")");
            }
        }
    }
    
    /**
     * Проверка без списка адаптеров (когда адаптеры переданы явно)
     */
    public void validateSettings() {
        ensureDefaults();
        getSeverityFloorLevel();
        if (adapterTimeoutSec <= 0) {
            throw new ConfigurationException("adapterTimeoutSec должен быть положительным: " + adapterTimeoutSec);
        }
        if (maxWorkers <= 0) {
            throw new ConfigurationException("maxWorkers должен быть положительным: " + maxWorkers);
        }
        if (runTimeoutSec != null && runTimeoutSec <= 0) {
            throw new ConfigurationException("runTimeoutSec должен быть положительным: " + runTimeoutSec);
        }
        for (Map.Entry<String, AdapterOptions> entry : adapterSettings.entrySet()) {
            Integer timeout = entry.getValue() != null ? entry.getValue().getTimeoutSec() : null;
            if (timeout != null && timeout <= 0) {
                throw new ConfigurationException("timeoutSec адаптера " + entry.getKey() + " должен быть положительным");
            }
        }
    }
    
    @JsonIgnore
    public Severity getSeverityFloorLevel() {
        try {
            return Severity.parse(severityFloor);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Неверный порог критичности: " + severityFloor, e);
        }
    }
    
    @JsonIgnore
    public Duration getAdapterTimeout() {
        return Duration.ofSeconds(adapterTimeoutSec);
    }
    
    /**
     * Общий бюджет: явный runTimeoutSec или сумма тайм-аутов перечисленных адаптеров
     * с учётом переопределений в adapterSettings
     */
    @JsonIgnore
    public Duration getRunTimeout(Collection<String> adapterNames) {
        if (runTimeoutSec != null && runTimeoutSec > 0) {
            return Duration.ofSeconds(runTimeoutSec);
        }
        if (adapterNames == null || adapterNames.isEmpty()) {
            return getAdapterTimeout();
        }
        Duration total = Duration.ZERO;
        for (String name : adapterNames) {
            total = total.plus(getAdapterTimeout(name));
        }
        return total;
    }
    
    /**
     * Тайм-аут адаптера с учётом переопределения в adapterSettings
     */
    @JsonIgnore
    public Duration getAdapterTimeout(String adapter) {
        Integer override = optionsFor(adapter).getTimeoutSec();
        return override != null && override > 0 ? Duration.ofSeconds(override) : getAdapterTimeout();
    }
    
    @JsonIgnore
    public AdapterOptions optionsFor(String adapter) {
        AdapterOptions options = adapterSettings.get(adapter);
        if (options == null) {
            options = adapterSettings.get(adapter.toLowerCase(Locale.ROOT));
        }
        return options != null ? options : new AdapterOptions();
    }
    
    private static Map<String, String> defaultCategoryMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("sql", "CWE-89");
        mapping.put("sqli", "CWE-89");
        mapping.put("xss", "CWE-79");
        mapping.put("cross-site", "CWE-79");
        mapping.put("path-traversal", "CWE-22");
        mapping.put("path_traversal", "CWE-22");
        mapping.put("traversal", "CWE-22");
        mapping.put("hardcoded", "CWE-798");
        mapping.put("secret", "CWE-798");
        mapping.put("password", "CWE-259");
        mapping.put("md5", "CWE-327");
        mapping.put("sha1", "CWE-327");
        mapping.put("weak-crypto", "CWE-327");
        mapping.put("insecure-hash", "CWE-328");
        mapping.put("command", "CWE-78");
        mapping.put("subprocess", "CWE-78");
        mapping.put("shell", "CWE-78");
        mapping.put("deserializ", "CWE-502");
        mapping.put("pickle", "CWE-502");
        mapping.put("ssrf", "CWE-918");
        mapping.put("eval", "CWE-95");
        return mapping;
    }
    
    /**
     * Описание загружаемого инструмента (стратегия 3 обнаружения)
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolSpec {
        private String version;
        private String sha256;
        /** Платформа (linux, mac, windows) -> URL, допускается плейсхолдер {version} */
        private Map<String, String> urls;
    }
    
    /**
     * Настройки конкретного адаптера
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdapterOptions {
        private List<String> rulesets;
        private List<String> extraArgs;
        /** Для DAST-адаптеров: адрес запущенного приложения */
        private String targetUrl;
        /** Переопределение общего тайм-аута */
        private Integer timeoutSec;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fingerprint {
        private static final int DEFAULT_LINE_BUCKET = 10;
        private static final int DEFAULT_LINE_TOLERANCE = 3;
        
        /** Размер "корзины" строк, когда якорь по коду недоступен */
        private Integer lineBucketSize;
        /**
         * Находки разных инструментов одной категории в одном файле, отстоящие не больше
         * чем на столько строк, сливаются, если хотя бы у одной нет фрагмента кода. 0 отключает.
         */
        private Integer lineTolerance;
        
        void ensureDefaults() {
            if (lineBucketSize == null || lineBucketSize <= 0) {
                lineBucketSize = DEFAULT_LINE_BUCKET;
            }
            if (lineTolerance == null || lineTolerance < 0) {
                lineTolerance = DEFAULT_LINE_TOLERANCE;
            }
        }
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Triage {
        private Integer minFileClusterSize;
        private Integer minPatternClusterSize;
        private Integer explanationMaxLength;
        private List<String> disabledClassifiers;
        
        void ensureDefaults() {
            if (minFileClusterSize == null || minFileClusterSize < 2) {
                minFileClusterSize = 2;
            }
            if (minPatternClusterSize == null || minPatternClusterSize < 2) {
                minPatternClusterSize = 2;
            }
            if (explanationMaxLength == null || explanationMaxLength < 40) {
                explanationMaxLength = 500;
            }
            if (disabledClassifiers == null) {
                disabledClassifiers = new ArrayList<>();
            }
        }
    }
    
    /**
     * Таблицы для оценки риска. Это данные, а не логика:
     * их подстраивают под эталонный корпус.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskTables {
        private Map<String, Double> impactBySeverity;
        private Map<String, Double> exploitabilityByCategory;
        private Map<String, Double> exploitabilityBySeverity;
        private Map<String, Double> detectionTimeByCategory;
        private Double defaultDetectionTime;
        private Double detectionTimeFloor;
        
        void ensureDefaults() {
            if (impactBySeverity == null) {
                impactBySeverity = new HashMap<>();
            }
            impactBySeverity.putIfAbsent("CRITICAL", 9.5);
            impactBySeverity.putIfAbsent("HIGH", 7.5);
            impactBySeverity.putIfAbsent("MEDIUM", 5.0);
            impactBySeverity.putIfAbsent("LOW", 2.5);
            impactBySeverity.putIfAbsent("INFO", 1.0);
            
            if (exploitabilityByCategory == null) {
                exploitabilityByCategory = new HashMap<>();
            }
            exploitabilityByCategory.putIfAbsent("CWE-78", 9.0);
            exploitabilityByCategory.putIfAbsent("CWE-798", 9.0);
            exploitabilityByCategory.putIfAbsent("CWE-89", 8.5);
            exploitabilityByCategory.putIfAbsent("CWE-94", 8.5);
            exploitabilityByCategory.putIfAbsent("CWE-79", 8.0);
            exploitabilityByCategory.putIfAbsent("CWE-502", 7.5);
            exploitabilityByCategory.putIfAbsent("CWE-22", 7.0);
            exploitabilityByCategory.putIfAbsent("CWE-918", 6.5);
            exploitabilityByCategory.putIfAbsent("CWE-327", 5.0);
            
            if (exploitabilityBySeverity == null) {
                exploitabilityBySeverity = new HashMap<>();
            }
            exploitabilityBySeverity.putIfAbsent("CRITICAL", 8.0);
            exploitabilityBySeverity.putIfAbsent("HIGH", 6.5);
            exploitabilityBySeverity.putIfAbsent("MEDIUM", 4.5);
            exploitabilityBySeverity.putIfAbsent("LOW", 2.5);
            exploitabilityBySeverity.putIfAbsent("INFO", 1.0);
            
            if (detectionTimeByCategory == null) {
                detectionTimeByCategory = new HashMap<>();
            }
            detectionTimeByCategory.putIfAbsent("CWE-89", 20.0);
            detectionTimeByCategory.putIfAbsent("CWE-78", 20.0);
            detectionTimeByCategory.putIfAbsent("CWE-79", 30.0);
            detectionTimeByCategory.putIfAbsent("CWE-22", 45.0);
            detectionTimeByCategory.putIfAbsent("CWE-798", 60.0);
            detectionTimeByCategory.putIfAbsent("CWE-502", 90.0);
            detectionTimeByCategory.putIfAbsent("CWE-327", 180.0);
            
            if (defaultDetectionTime == null || defaultDetectionTime <= 0) {
                defaultDetectionTime = 30.0;
            }
            if (detectionTimeFloor == null || detectionTimeFloor <= 0) {
                detectionTimeFloor = 1.0;
            }
        }
    }
}
