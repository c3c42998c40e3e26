package com.z254.triage.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a page of incidents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentPageResponse {
    private List<IncidentDto> content;
    private int number;
    private int size;
    private long totalElements;
    private int totalPages;
}
