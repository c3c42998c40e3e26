package com.z254.triage.domain.model;

/**
 * Severity tier assigned at triage time.
 * <p>
 * Declared from most to least urgent; {@link #rank()} follows that order.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Urgency rank, higher is more urgent (CRITICAL = 4, LOW = 1).
     */
    public int rank() {
        return values().length - ordinal();
    }
}
