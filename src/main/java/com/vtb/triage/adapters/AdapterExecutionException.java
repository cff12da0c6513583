package com.vtb.triage.adapters;

import com.vtb.triage.core.TriageEngineException;

/**
 * Инструмент завершился с ошибкой или не смог быть запущен
 */
public class AdapterExecutionException extends TriageEngineException {
    
    public AdapterExecutionException(String message) {
        super(message);
    }
    
    public AdapterExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
