package com.z254.triage.domain.exception;

/**
 * Raised when a status value is not a known {@code IncidentStatus}.
 */
public class InvalidStatusException extends TriageException {

    private final String rejectedValue;

    public InvalidStatusException(String rejectedValue) {
        super("Invalid status: " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
