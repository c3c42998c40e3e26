package com.z254.triage.api.dto;

import com.z254.triage.domain.model.NewIncident;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for reporting a new incident.
 * <p>
 * Required fields are checked by the triage pipeline, not by bean validation, so every
 * intake path reports missing fields the same way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIncidentRequest {

    @Schema(description = "Short summary", example = "Server is down, critical outage",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String title;

    @Schema(description = "Free-text report", requiredMode = Schema.RequiredMode.REQUIRED)
    private String description;

    @Schema(description = "Service the incident affects", example = "auth-service",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String affectedService;

    /**
     * Convert to domain model.
     */
    public NewIncident toNewIncident() {
        return NewIncident.builder()
                .title(title)
                .description(description)
                .affectedService(affectedService)
                .build();
    }
}
