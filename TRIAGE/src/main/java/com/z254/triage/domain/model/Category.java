package com.z254.triage.domain.model;

/**
 * Functional area an incident is attributed to.
 */
public enum Category {
    SECURITY,
    NETWORK,
    DATABASE,
    FRONTEND,
    HARDWARE,
    SOFTWARE
}
