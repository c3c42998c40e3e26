package com.z254.triage.domain.exception;

/**
 * Base class for errors raised by incident triage operations.
 * <p>
 * None of these errors is transient; callers should not retry.
 */
public abstract class TriageException extends RuntimeException {

    protected TriageException(String message) {
        super(message);
    }
}
