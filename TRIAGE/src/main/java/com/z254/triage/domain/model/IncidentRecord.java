package com.z254.triage.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A stored, triaged incident.
 * <p>
 * Instances are immutable. A status change produces a new instance via
 * {@link #withStatus(IncidentStatus, Instant)}; all triage fields are carried over unchanged.
 */
@Value
@Builder(toBuilder = true)
public class IncidentRecord {

    /** Store-assigned identifier, strictly increasing */
    long id;

    String title;

    String description;

    String affectedService;

    @Builder.Default
    IncidentStatus status = IncidentStatus.OPEN;

    Severity aiSeverity;

    Category aiCategory;

    String aiSuggestedAction;

    double confidenceScore;

    Instant createdAt;

    Instant updatedAt;

    /**
     * Copy of this record with a new status. {@code updatedAt} never moves before {@code createdAt}.
     */
    public IncidentRecord withStatus(IncidentStatus newStatus, Instant now) {
        Instant stamped = createdAt != null && now.isBefore(createdAt) ? createdAt : now;
        return toBuilder()
                .status(newStatus)
                .updatedAt(stamped)
                .build();
    }
}
