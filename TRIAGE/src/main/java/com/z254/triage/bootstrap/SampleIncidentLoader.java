package com.z254.triage.bootstrap;

import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.NewIncident;
import com.z254.triage.domain.service.IncidentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Loads demo incidents at startup.
 * <p>
 * Samples go through the regular triage pipeline, so their annotations always
 * agree with the current rules. They are backdated a few hours apart, the
 * database timeout being the most recent.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "triage.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SampleIncidentLoader {

    private final IncidentService incidentService;
    private final Clock clock;

    @Value("${server.port:8080}")
    private int serverPort;

    public SampleIncidentLoader(IncidentService incidentService, Clock clock) {
        this.incidentService = incidentService;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadSamples() {
        List<SampleIncident> samples = samples(clock.instant());
        for (SampleIncident sample : samples) {
            IncidentRecord created = incidentService.createIncident(sample.incident());
            if (sample.status() != IncidentStatus.OPEN) {
                incidentService.updateStatus(created.getId(), sample.status().name());
            }
        }
        log.info("TRIAGE incident service running on http://localhost:{}", serverPort);
        log.info("Sample incidents loaded: {}", samples.size());
    }

    static List<SampleIncident> samples(Instant now) {
        return List.of(
                new SampleIncident(NewIncident.builder()
                        .title("Database connection timeout")
                        .description("Users are experiencing slow response times when accessing the user dashboard. "
                                + "Database queries are timing out after 30 seconds.")
                        .affectedService("user-dashboard")
                        .reportedAt(now.minus(Duration.ofHours(2)))
                        .build(), IncidentStatus.OPEN),
                new SampleIncident(NewIncident.builder()
                        .title("Security vulnerability in authentication service")
                        .description("Potential SQL injection vulnerability discovered in the login endpoint. "
                                + "This could allow unauthorized access to user accounts.")
                        .affectedService("authentication-service")
                        .reportedAt(now.minus(Duration.ofHours(4)))
                        .build(), IncidentStatus.IN_PROGRESS),
                new SampleIncident(NewIncident.builder()
                        .title("Frontend CSS styling issue")
                        .description("The navigation menu is not displaying correctly on mobile devices. "
                                + "Users report that menu items are overlapping.")
                        .affectedService("web-frontend")
                        .reportedAt(now.minus(Duration.ofHours(6)))
                        .build(), IncidentStatus.RESOLVED));
    }

    record SampleIncident(NewIncident incident, IncidentStatus status) {
    }
}
