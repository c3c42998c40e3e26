package com.z254.triage.query;

import lombok.Builder;
import lombok.Value;

/**
 * Raw list parameters as supplied by a caller. Any of them may be null; the
 * {@link IncidentQueryEngine} resolves defaults.
 */
@Value
@Builder
public class IncidentQuery {

    /** Zero-based page number */
    Integer page;

    /** Page size */
    Integer size;

    /** Exact severity name to keep, e.g. "CRITICAL" */
    String severity;

    /** Exact category name to keep, e.g. "DATABASE" */
    String category;

    /** API field name to sort by, see {@link IncidentSortField} */
    String sortBy;

    /** "asc" or "desc" */
    String sortDir;

    public static IncidentQuery defaults() {
        return IncidentQuery.builder().build();
    }
}
