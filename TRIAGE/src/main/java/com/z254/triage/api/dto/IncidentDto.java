package com.z254.triage.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentDto {
    private long id;
    private String title;
    private String description;
    private String affectedService;
    private String status;
    private String aiSeverity;
    private String aiCategory;
    private String aiSuggestedAction;
    private double confidenceScore;
    private Instant createdAt;
    private Instant updatedAt;
}
