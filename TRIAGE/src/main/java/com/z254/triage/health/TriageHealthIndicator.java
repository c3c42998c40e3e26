package com.z254.triage.health;

import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the TRIAGE service.
 * <p>
 * Reports the incident store size and how many incidents are still open.
 */
@Slf4j
@Component
public class TriageHealthIndicator implements ReactiveHealthIndicator {

    private final IncidentRepository incidentRepository;

    public TriageHealthIndicator(IncidentRepository incidentRepository) {
        this.incidentRepository = incidentRepository;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed for incident store", e);
                    return Mono.just(Health.down()
                            .withDetail("store.error", "Failed to read incident store: " + e.getMessage())
                            .build());
                });
    }

    private Health checkHealth() {
        List<IncidentRecord> snapshot = incidentRepository.findAll();
        long open = snapshot.stream()
                .filter(incident -> incident.getStatus() == IncidentStatus.OPEN)
                .count();

        Map<String, Object> details = new HashMap<>();
        details.put("store", incidentRepository.getClass().getSimpleName());
        details.put("storedIncidents", snapshot.size());
        details.put("openIncidents", open);

        return Health.up()
                .withDetails(details)
                .build();
    }
}
