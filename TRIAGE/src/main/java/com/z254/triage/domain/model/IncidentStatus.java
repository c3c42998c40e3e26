package com.z254.triage.domain.model;

import com.z254.triage.domain.exception.InvalidStatusException;

/**
 * Incident lifecycle status.
 */
public enum IncidentStatus {
    OPEN,
    IN_PROGRESS,
    RESOLVED,
    CLOSED;

    /**
     * Parse a status name. Matching is exact: "open" or " OPEN" are rejected.
     *
     * @throws InvalidStatusException if the value is not one of the declared statuses
     */
    public static IncidentStatus parse(String value) {
        if (value != null) {
            for (IncidentStatus status : values()) {
                if (status.name().equals(value)) {
                    return status;
                }
            }
        }
        throw new InvalidStatusException(value);
    }
}
