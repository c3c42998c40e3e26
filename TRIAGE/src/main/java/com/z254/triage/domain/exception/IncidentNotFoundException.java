package com.z254.triage.domain.exception;

/**
 * Raised when no incident exists for the requested id.
 */
public class IncidentNotFoundException extends TriageException {

    private final long incidentId;

    public IncidentNotFoundException(long incidentId) {
        super("Incident not found: " + incidentId);
        this.incidentId = incidentId;
    }

    public long getIncidentId() {
        return incidentId;
    }
}
