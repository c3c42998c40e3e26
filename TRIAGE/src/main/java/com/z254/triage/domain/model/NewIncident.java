package com.z254.triage.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Caller-supplied fields of an incident report, before triage.
 */
@Value
@Builder
public class NewIncident {
    String title;
    String description;
    String affectedService;
    /** When the incident was first reported; {@code null} means now */
    Instant reportedAt;
}
