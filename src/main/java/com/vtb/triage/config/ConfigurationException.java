package com.vtb.triage.config;

/**
 * Ошибка конфигурации: неверный путь цели, неизвестный адаптер, неверный порог критичности.
 * Фатальна, выбрасывается до запуска любого адаптера.
 */
public class ConfigurationException extends RuntimeException {
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
