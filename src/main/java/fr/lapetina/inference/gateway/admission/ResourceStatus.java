package fr.lapetina.inference.gateway.admission;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Point-in-time snapshot of the admission ledger and host pressure.
 */
public record ResourceStatus(
        int activeRequests,
        int maxConcurrent,
        double cpuUsagePercent,
        OptionalDouble gpuMemoryFraction
) {
    public boolean atCapacity() {
        return activeRequests >= maxConcurrent;
    }

    /**
     * Flattens the snapshot with the field names used by the health surface.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("active_requests", activeRequests);
        map.put("max_concurrent", maxConcurrent);
        map.put("cpu_usage_percent", cpuUsagePercent);
        if (gpuMemoryFraction.isPresent()) {
            map.put("gpu_memory_percent", gpuMemoryFraction.getAsDouble() * 100.0);
        } else {
            map.put("gpu_available", false);
        }
        return map;
    }
}
