package com.z254.triage.api.v1;

import com.z254.triage.api.dto.CreateIncidentRequest;
import com.z254.triage.api.dto.IncidentDto;
import com.z254.triage.api.dto.IncidentPageResponse;
import com.z254.triage.api.dto.IncidentStatsResponse;
import com.z254.triage.api.mapper.IncidentMapper;
import com.z254.triage.domain.service.IncidentService;
import com.z254.triage.query.IncidentQuery;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST API controller for incident intake and querying.
 * <p>
 * Also served under the unversioned {@code /api/incidents} path used by existing clients.
 */
@Slf4j
@RestController
@RequestMapping({"/api/v1/incidents", "/api/incidents"})
@Tag(name = "Incidents", description = "Incident intake, triage and querying")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "Paginated incident list with optional filters")
    public Mono<ResponseEntity<IncidentPageResponse>> listIncidents(
            @Parameter(description = "Zero-based page number")
            @RequestParam(defaultValue = "0") Integer page,
            @Parameter(description = "Page size")
            @RequestParam(required = false) Integer size,
            @Parameter(description = "Filter by severity (CRITICAL, HIGH, MEDIUM, LOW)")
            @RequestParam(required = false) String severity,
            @Parameter(description = "Filter by category")
            @RequestParam(required = false) String category,
            @Parameter(description = "Sort field: id, createdAt, updatedAt, aiSeverity, aiCategory, status, confidenceScore")
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @Parameter(description = "Sort direction (asc or desc)")
            @RequestParam(defaultValue = "desc") String sortDir) {

        IncidentQuery query = IncidentQuery.builder()
                .page(page)
                .size(size)
                .severity(severity)
                .category(category)
                .sortBy(sortBy)
                .sortDir(sortDir)
                .build();

        return Mono.fromCallable(() -> incidentService.listIncidents(query))
                .map(IncidentMapper::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    @Operation(summary = "Incident statistics", description = "Counts by severity, category and status")
    public Mono<ResponseEntity<IncidentStatsResponse>> getStats() {
        return Mono.fromCallable(incidentService::getStats)
                .map(IncidentMapper::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    @ApiResponse(responseCode = "200", description = "Incident found")
    @ApiResponse(responseCode = "404", description = "Incident not found")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable long id) {

        return Mono.fromCallable(() -> incidentService.getIncident(id))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok);
    }

    @PostMapping
    @Operation(summary = "Report incident", description = "Triage and store a new incident")
    @ApiResponse(responseCode = "201", description = "Incident triaged and stored")
    @ApiResponse(responseCode = "400", description = "Title, description or affected service missing")
    public Mono<ResponseEntity<IncidentDto>> createIncident(
            @RequestBody(required = false) CreateIncidentRequest request) {

        CreateIncidentRequest body = request != null ? request : new CreateIncidentRequest();
        log.info("Reporting incident: {} ({})", body.getTitle(), body.getAffectedService());

        return Mono.fromCallable(() -> incidentService.createIncident(body.toNewIncident()))
                .map(IncidentMapper::toDto)
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/{id}/status")
    @Operation(summary = "Update status", description = "Move an incident to OPEN, IN_PROGRESS, RESOLVED or CLOSED")
    @ApiResponse(responseCode = "200", description = "Status updated")
    @ApiResponse(responseCode = "400", description = "Invalid status")
    @ApiResponse(responseCode = "404", description = "Incident not found")
    public Mono<ResponseEntity<IncidentDto>> updateStatus(
            @Parameter(description = "Incident ID") @PathVariable long id,
            @Parameter(description = "Target status") @RequestParam(required = false) String status) {

        return Mono.fromCallable(() -> incidentService.updateStatus(id, status))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok);
    }
}
