package com.z254.triage.domain.service;

import com.z254.triage.analysis.TriagePipeline;
import com.z254.triage.domain.exception.IncidentNotFoundException;
import com.z254.triage.domain.exception.IncidentValidationException;
import com.z254.triage.domain.exception.InvalidStatusException;
import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.NewIncident;
import com.z254.triage.domain.model.TriageAssessment;
import com.z254.triage.domain.repository.IncidentRepository;
import com.z254.triage.observability.TriageMetrics;
import com.z254.triage.observability.TriageStructuredLogger;
import com.z254.triage.observability.TriageStructuredLogger.IncidentEventType;
import com.z254.triage.query.IncidentPage;
import com.z254.triage.query.IncidentQuery;
import com.z254.triage.query.IncidentQueryEngine;
import com.z254.triage.stats.IncidentStats;
import com.z254.triage.stats.IncidentStatsAggregator;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Central service for incident intake, lookup and lifecycle state.
 * <p>
 * Reads go through a store snapshot and never modify records.
 */
@Service
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final TriagePipeline triagePipeline;
    private final IncidentQueryEngine queryEngine;
    private final IncidentStatsAggregator statsAggregator;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger logger;

    public IncidentService(IncidentRepository incidentRepository,
                           TriagePipeline triagePipeline,
                           IncidentQueryEngine queryEngine,
                           IncidentStatsAggregator statsAggregator,
                           TriageMetrics metrics,
                           TriageStructuredLogger logger) {
        this.incidentRepository = incidentRepository;
        this.triagePipeline = triagePipeline;
        this.queryEngine = queryEngine;
        this.statsAggregator = statsAggregator;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Triage and store a new incident.
     *
     * @throws IncidentValidationException if a required field is missing; nothing is stored
     */
    public IncidentRecord createIncident(NewIncident newIncident) {
        Timer.Sample sample = metrics.startAnalysisTimer();
        TriageAssessment assessment;
        try {
            assessment = logger.timed("triage.assess", () -> triagePipeline.assess(newIncident));
        } catch (IncidentValidationException e) {
            metrics.recordRejected("validation");
            logger.logIncidentEvent(null, IncidentEventType.VALIDATION_FAILED, "Incident rejected",
                    Map.of("missingFields", String.join(",", e.getMissingFields())));
            throw e;
        } finally {
            metrics.recordAnalysis(sample);
        }

        IncidentRecord incident = incidentRepository.insert(newIncident, assessment);

        metrics.recordIncidentCreated(incident.getAiSeverity(), incident.getAiCategory(),
                incident.getConfidenceScore());
        logger.logIncidentEvent(incident.getId(), IncidentEventType.CREATED, "Incident triaged",
                Map.of("severity", incident.getAiSeverity().name(),
                        "category", incident.getAiCategory().name(),
                        "confidence", incident.getConfidenceScore(),
                        "affectedService", incident.getAffectedService()));
        return incident;
    }

    /**
     * @throws IncidentNotFoundException if no incident has this ID
     */
    public IncidentRecord getIncident(long id) {
        return incidentRepository.findById(id)
                .orElseThrow(() -> notFound(id));
    }

    public IncidentPage listIncidents(IncidentQuery query) {
        return queryEngine.execute(incidentRepository.findAll(), query);
    }

    /**
     * Move an incident to a new status. An unknown ID is reported before an invalid status.
     *
     * @throws IncidentNotFoundException if no incident has this ID
     * @throws InvalidStatusException if the status is not a known {@link IncidentStatus}
     */
    public IncidentRecord updateStatus(long id, String status) {
        IncidentRecord current = getIncident(id);

        IncidentStatus target;
        try {
            target = IncidentStatus.parse(status);
        } catch (InvalidStatusException e) {
            metrics.recordRejected("invalid_status");
            logger.logIncidentEvent(id, IncidentEventType.INVALID_STATUS, "Status change rejected",
                    Map.of("requestedStatus", String.valueOf(status)));
            throw e;
        }

        IncidentRecord updated = incidentRepository.updateStatus(id, target)
                .orElseThrow(() -> notFound(id));

        metrics.recordStatusChanged(target);
        logger.logIncidentEvent(id, IncidentEventType.STATUS_CHANGED, "Incident status changed",
                Map.of("from", current.getStatus().name(), "to", target.name()));
        return updated;
    }

    public IncidentStats getStats() {
        return statsAggregator.aggregate(incidentRepository.findAll());
    }

    private IncidentNotFoundException notFound(long id) {
        metrics.recordRejected("not_found");
        logger.logIncidentEvent(id, IncidentEventType.NOT_FOUND, "Incident not found");
        return new IncidentNotFoundException(id);
    }
}
