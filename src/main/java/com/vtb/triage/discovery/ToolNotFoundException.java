package com.vtb.triage.discovery;

import com.vtb.triage.core.TriageEngineException;

import java.util.List;

/**
 * Инструмент не найден ни одной стратегией обнаружения
 */
public class ToolNotFoundException extends TriageEngineException {
    
    private final String toolName;
    private final List<String> checkedLocations;
    
    public ToolNotFoundException(String toolName, List<String> checkedLocations) {
        super("Инструмент '" + toolName + "' не найден. Проверено: " + String.join("; ", checkedLocations));
        this.toolName = toolName;
        this.checkedLocations = List.copyOf(checkedLocations);
    }
    
    public String getToolName() {
        return toolName;
    }
    
    public List<String> getCheckedLocations() {
        return checkedLocations;
    }
}
