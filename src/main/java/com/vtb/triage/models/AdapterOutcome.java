package com.vtb.triage.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Учёт результата адаптера в оркестрации
 */
@Value
@Builder
@Jacksonized
public class AdapterOutcome {
    String adapter;
    AdapterStatus status;
    /** Причина пропуска/ошибки, null для успешных */
    String reason;
    @Builder.Default
    int findingCount = 0;
    @Builder.Default
    long durationMs = 0;
    
    public static AdapterOutcome skipped(String adapter, String reason) {
        return AdapterOutcome.builder().adapter(adapter).status(AdapterStatus.SKIPPED).reason(reason).build();
    }
}
