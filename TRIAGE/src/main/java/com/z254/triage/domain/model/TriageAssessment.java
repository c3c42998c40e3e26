package com.z254.triage.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Triage annotations computed once for a new incident.
 */
@Value
@Builder
public class TriageAssessment {

    Severity severity;

    Category category;

    /** Remediation advice for the (severity, category) pair */
    String suggestedAction;

    /** Evidence score in [0.5, 1.0] */
    double confidenceScore;
}
