package com.z254.triage.stats;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Frequency breakdown of all stored incidents. Values with no occurrences are absent.
 */
@Value
@Builder
public class IncidentStats {
    long total;
    Map<Severity, Long> severity;
    Map<Category, Long> category;
    Map<IncidentStatus, Long> status;
}
