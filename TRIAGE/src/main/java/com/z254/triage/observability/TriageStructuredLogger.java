package com.z254.triage.observability;

import com.z254.triage.config.TriageProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging utility for the TRIAGE service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for incident IDs</li>
 *     <li>Incident lifecycle logging</li>
 *     <li>Performance timing utilities</li>
 * </ul>
 */
@Slf4j
@Component
public class TriageStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_OPERATION = "operation";

    private final TriageProperties triageProperties;

    public TriageStructuredLogger(TriageProperties triageProperties) {
        this.triageProperties = triageProperties;
    }

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(Long incidentId, IncidentEventType eventType, String message) {
        logIncidentEvent(incidentId, eventType, message, null);
    }

    /**
     * Log an incident lifecycle event with details. {@code incidentId} is null for
     * events about requests that never produced an incident.
     */
    public void logIncidentEvent(Long incidentId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        String id = incidentId != null ? String.valueOf(incidentId) : "";
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, id))) {
            Map<String, Object> logData = new HashMap<>();
            logData.put("event", eventType.name());
            if (incidentId != null) {
                logData.put("incidentId", incidentId);
            }

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CREATED, STATUS_CHANGED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case VALIDATION_FAILED, NOT_FOUND, INVALID_STATUS ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);

        if (details != null) {
            logData.putAll(details);
        }

        if (duration.compareTo(triageProperties.getLogging().getSlowOperationThreshold()) > 0) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Execute a timed operation with logging.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try (var scope = withContext(Map.of(MDC_OPERATION, operation))) {
            T result = action.get();
            success = true;
            return result;
        } finally {
            Duration duration = Duration.between(start, Instant.now());
            logPerformance(operation, duration, success, null);
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum IncidentEventType {
        CREATED, STATUS_CHANGED, VALIDATION_FAILED, NOT_FOUND, INVALID_STATUS
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
