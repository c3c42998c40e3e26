package com.z254.triage.observability;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.Severity;
import com.z254.triage.domain.repository.IncidentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the TRIAGE service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Incident intake (created, by severity and category)</li>
 *     <li>Triage analysis latency and confidence</li>
 *     <li>Status transitions and rejected requests</li>
 * </ul>
 */
@Component
public class TriageMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer analysisLatency;
    private final DistributionSummary confidence;
    private final Map<String, Counter> createdByTriage = new ConcurrentHashMap<>();
    private final Map<IncidentStatus, Counter> statusChanges = new ConcurrentHashMap<>();
    private final Map<String, Counter> rejections = new ConcurrentHashMap<>();

    public TriageMetrics(MeterRegistry meterRegistry, IncidentRepository incidentRepository) {
        this.meterRegistry = meterRegistry;

        this.analysisLatency = Timer.builder("triage.analysis.latency")
                .description("Triage analysis latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.confidence = DistributionSummary.builder("triage.confidence")
                .description("Confidence scores of triaged incidents")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        Gauge.builder("triage.incidents.stored", incidentRepository, IncidentRepository::count)
                .description("Incidents currently stored")
                .register(meterRegistry);
    }

    // ========== Intake ==========

    public Timer.Sample startAnalysisTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordAnalysis(Timer.Sample sample) {
        sample.stop(analysisLatency);
    }

    public void recordIncidentCreated(Severity severity, Category category, double confidenceScore) {
        createdByTriage.computeIfAbsent(severity.name() + "/" + category.name(), key ->
                Counter.builder("triage.incidents.created")
                        .tag("severity", severity.name())
                        .tag("category", category.name())
                        .description("Incidents created")
                        .register(meterRegistry))
                .increment();
        confidence.record(confidenceScore);
    }

    // ========== Lifecycle ==========

    public void recordStatusChanged(IncidentStatus status) {
        statusChanges.computeIfAbsent(status, s ->
                Counter.builder("triage.incidents.status_changes")
                        .tag("status", s.name())
                        .description("Incident status changes")
                        .register(meterRegistry))
                .increment();
    }

    public void recordRejected(String reason) {
        rejections.computeIfAbsent(reason, r ->
                Counter.builder("triage.incidents.rejected")
                        .tag("reason", r)
                        .description("Rejected incident operations")
                        .register(meterRegistry))
                .increment();
    }
}
