package io.resolvemesh.observability;

import io.resolvemesh.runtime.EngineStats;

import java.util.Map;
import java.util.TreeMap;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(EngineStats stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "resolvemesh_requests", "Requests grouped by lifecycle state", "state", stats.requestsByState());
        appendMapGauge(sb, "resolvemesh_requests_finalized", "Finalized requests grouped by finalization",
                "finalization", stats.requestsByFinalization());
        appendGauge(sb, "resolvemesh_requests_needing_operator", "Requests flagged for operator attention", null, null,
                stats.needsOperator());
        appendGauge(sb, "resolvemesh_in_flight", "Requests with an execution or settlement task in flight", null, null,
                stats.inFlight());
        appendGauge(sb, "resolvemesh_executions_running", "Sandbox executions currently running", null, null,
                stats.runningExecutions());
        appendGauge(sb, "resolvemesh_worker_pool_size", "Configured sandbox execution capacity", null, null,
                stats.workerPoolSize());
        appendGauge(sb, "resolvemesh_queue_depth", "Requests waiting in the eligibility queue", null, null, stats.queued());
        appendGauge(sb, "resolvemesh_clock_offset_ms", "Clock anchor offset from local time in milliseconds", null, null,
                stats.clockOffsetMs());
        appendGauge(sb, "resolvemesh_clock_age_ms", "Milliseconds since the last successful clock sync (-1 = never)",
                null, null, stats.clockAgeMs());
        appendGauge(sb, "resolvemesh_clock_stale", "Clock anchor staleness flag (1=stale,0=fresh)", null, null,
                stats.clockStale() ? 1L : 0L);
        for (Map.Entry<String, Long> e : new TreeMap<>(stats.counters()).entrySet()) {
            appendGauge(sb, "resolvemesh_scheduler_events_total", "Scheduler outcomes since start", "event", e.getKey(),
                    e.getValue());
        }
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : new TreeMap<>(values).entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
