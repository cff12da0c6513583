package com.vtb.triage.adapters;

import com.vtb.triage.discovery.ToolDiscovery;

import java.util.List;

/**
 * Встроенные адаптеры
 */
public final class AdapterRegistry {
    
    private AdapterRegistry() {
    }
    
    public static List<ScannerAdapter> defaults(ToolDiscovery discovery) {
        ProcessRunner runner = new ProcessRunner();
        return List.of(
            new SemgrepAdapter(discovery, runner),
            new BanditAdapter(discovery, runner),
            new NucleiAdapter(discovery, runner)
        );
    }
}
