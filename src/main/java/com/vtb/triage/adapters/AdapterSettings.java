package com.vtb.triage.adapters;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Параметры одного запуска адаптера (собираются оркестратором из конфигурации)
 */
@Value
@Builder
public class AdapterSettings {
    @Builder.Default
    Duration timeout = Duration.ofMinutes(5);
    @Singular("includeGlob")
    List<String> include;
    @Singular("excludeGlob")
    List<String> exclude;
    @Singular
    List<String> rulesets;
    @Singular
    List<String> extraArgs;
    String targetUrl;
    
    public static AdapterSettings defaults() {
        return AdapterSettings.builder().build();
    }
}
