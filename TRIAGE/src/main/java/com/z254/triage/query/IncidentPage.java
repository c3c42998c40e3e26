package com.z254.triage.query;

import com.z254.triage.domain.model.IncidentRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a filtered, sorted incident list.
 */
@Value
@Builder
public class IncidentPage {

    List<IncidentRecord> content;

    /** Effective page number */
    int number;

    /** Effective page size */
    int size;

    /** Matching incidents before pagination */
    long totalElements;

    int totalPages;
}
