package com.vtb.triage.adapters;

import com.vtb.triage.core.TriageEngineException;

/**
 * Адаптер превысил бюджет времени; процесс принудительно завершён, частичный вывод отброшен
 */
public class AdapterTimeoutException extends TriageEngineException {
    
    public AdapterTimeoutException(String message) {
        super(message);
    }
    
    public AdapterTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
