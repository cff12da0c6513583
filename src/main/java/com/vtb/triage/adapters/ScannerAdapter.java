package com.vtb.triage.adapters;

import com.vtb.triage.core.TriageEngineException;
import com.vtb.triage.models.RawFinding;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Адаптер внешнего сканера.
 * Каждая реализация сама запускает свой инструмент и разбирает его родной формат.
 */
public interface ScannerAdapter {
    
    String name();
    
    /**
     * Версия инструмента, если её удалось определить
     */
    Optional<String> version();
    
    /**
     * Доступен ли инструмент (делегирует обнаружению, результат кэшируется)
     */
    boolean isAvailable();
    
    /**
     * Запустить сканирование.
     * Некорректный вывод инструмента даёт пустой список и предупреждение в логе.
     *
     * @throws AdapterTimeoutException   превышен тайм-аут
     * @throws AdapterExecutionException инструмент завершился с ошибкой
     */
    List<RawFinding> scan(Path target, AdapterSettings settings) throws TriageEngineException;
    
    /**
     * Как установить инструмент, если он недоступен
     */
    String installInstructions();
}
