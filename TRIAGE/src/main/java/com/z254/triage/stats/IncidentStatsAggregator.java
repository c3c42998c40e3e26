package com.z254.triage.stats;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts incidents by severity, category and status in a single pass.
 */
@Component
public class IncidentStatsAggregator {

    public IncidentStats aggregate(Collection<IncidentRecord> incidents) {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Map<Category, Long> byCategory = new EnumMap<>(Category.class);
        Map<IncidentStatus, Long> byStatus = new EnumMap<>(IncidentStatus.class);

        for (IncidentRecord incident : incidents) {
            bySeverity.merge(incident.getAiSeverity(), 1L, Long::sum);
            byCategory.merge(incident.getAiCategory(), 1L, Long::sum);
            byStatus.merge(incident.getStatus(), 1L, Long::sum);
        }

        return IncidentStats.builder()
                .total(incidents.size())
                .severity(Collections.unmodifiableMap(bySeverity))
                .category(Collections.unmodifiableMap(byCategory))
                .status(Collections.unmodifiableMap(byStatus))
                .build();
    }
}
