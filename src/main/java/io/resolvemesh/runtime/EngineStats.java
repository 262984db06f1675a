package io.resolvemesh.runtime;

import java.util.Map;

public record EngineStats(
        Map<String, Integer> requestsByState,
        Map<String, Integer> requestsByFinalization,
        int needsOperator,
        int inFlight,
        int runningExecutions,
        int workerPoolSize,
        int queued,
        long clockOffsetMs,
        long clockAgeMs,
        boolean clockStale,
        Map<String, Long> counters
) {
    public EngineStats {
        requestsByState = Map.copyOf(requestsByState);
        requestsByFinalization = Map.copyOf(requestsByFinalization);
        counters = Map.copyOf(counters);
    }
}
