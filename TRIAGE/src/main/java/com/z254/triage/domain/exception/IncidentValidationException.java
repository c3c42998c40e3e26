package com.z254.triage.domain.exception;

import java.util.List;

/**
 * Raised when a new incident is missing required fields. No record is created.
 */
public class IncidentValidationException extends TriageException {

    private final List<String> missingFields;

    public IncidentValidationException(List<String> missingFields) {
        super("Title, description, and affected service are required (missing: "
                + String.join(", ", missingFields) + ")");
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
