package com.vtb.triage.discovery;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Найденный исполняемый файл инструмента
 */
@Value
@Builder
public class ToolHandle {
    String name;
    Path path;
    /** Версия известна только для инструментов из кэша */
    String version;
    /** Имя стратегии, которая нашла инструмент */
    String foundBy;
}
