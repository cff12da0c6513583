package com.vtb.triage.discovery;

import java.util.List;
import java.util.Optional;

/**
 * Одно звено цепочки обнаружения инструмента.
 */
public interface LocationStrategy {
    
    String name();
    
    /**
     * Найти инструмент.
     *
     * @param toolName имя инструмента
     * @param checked  сюда дописываются проверенные места (для сообщения об ошибке)
     * @return найденный инструмент или пусто
     */
    Optional<ToolHandle> find(String toolName, List<String> checked);
}
