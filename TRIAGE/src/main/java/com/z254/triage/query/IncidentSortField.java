package com.z254.triage.query;

import com.z254.triage.domain.model.IncidentRecord;

import java.util.Comparator;
import java.util.Optional;

/**
 * Fields an incident list can be sorted by, keyed by their API field name.
 * <p>
 * Enumerated fields sort by meaning rather than by name: severity by urgency rank,
 * status by lifecycle order, category by declaration order.
 */
public enum IncidentSortField {

    ID("id", Comparator.comparingLong(IncidentRecord::getId)),
    CREATED_AT("createdAt", Comparator.comparing(IncidentRecord::getCreatedAt)),
    UPDATED_AT("updatedAt", Comparator.comparing(IncidentRecord::getUpdatedAt)),
    SEVERITY("aiSeverity", Comparator.comparingInt((IncidentRecord r) -> r.getAiSeverity().rank())),
    CATEGORY("aiCategory", Comparator.comparing(IncidentRecord::getAiCategory)),
    STATUS("status", Comparator.comparing(IncidentRecord::getStatus)),
    CONFIDENCE_SCORE("confidenceScore", Comparator.comparingDouble(IncidentRecord::getConfidenceScore));

    public static final IncidentSortField DEFAULT = CREATED_AT;

    private final String fieldName;
    private final Comparator<IncidentRecord> ascending;

    IncidentSortField(String fieldName, Comparator<IncidentRecord> ascending) {
        this.fieldName = fieldName;
        this.ascending = ascending;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Comparator<IncidentRecord> comparator(boolean descending) {
        return descending ? ascending.reversed() : ascending;
    }

    public static Optional<IncidentSortField> fromFieldName(String fieldName) {
        for (IncidentSortField field : values()) {
            if (field.fieldName.equals(fieldName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
