package com.vtb.triage.core;

/**
 * Базовое проверяемое исключение движка
 */
public class TriageEngineException extends Exception {
    
    public TriageEngineException(String message) {
        super(message);
    }
    
    public TriageEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
