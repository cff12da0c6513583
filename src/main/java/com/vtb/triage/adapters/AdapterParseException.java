package com.vtb.triage.adapters;

import com.vtb.triage.core.TriageEngineException;

/**
 * Вывод инструмента не удалось разобрать
 */
public class AdapterParseException extends TriageEngineException {
    
    public AdapterParseException(String message) {
        super(message);
    }
    
    public AdapterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
