package com.z254.triage.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for incident statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentStatsResponse {
    private long total;
    private Map<String, Long> severity;
    private Map<String, Long> category;
    private Map<String, Long> status;
}
