package com.z254.triage.api.mapper;

import com.z254.triage.api.dto.IncidentDto;
import com.z254.triage.api.dto.IncidentPageResponse;
import com.z254.triage.api.dto.IncidentStatsResponse;
import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.query.IncidentPage;
import com.z254.triage.stats.IncidentStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(IncidentRecord incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .title(incident.getTitle())
                .description(incident.getDescription())
                .affectedService(incident.getAffectedService())
                .status(incident.getStatus().name())
                .aiSeverity(incident.getAiSeverity().name())
                .aiCategory(incident.getAiCategory().name())
                .aiSuggestedAction(incident.getAiSuggestedAction())
                .confidenceScore(incident.getConfidenceScore())
                .createdAt(incident.getCreatedAt())
                .updatedAt(incident.getUpdatedAt())
                .build();
    }

    public static IncidentPageResponse toResponse(IncidentPage page) {
        return IncidentPageResponse.builder()
                .content(page.getContent().stream().map(IncidentMapper::toDto).toList())
                .number(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .build();
    }

    public static IncidentStatsResponse toResponse(IncidentStats stats) {
        return IncidentStatsResponse.builder()
                .total(stats.getTotal())
                .severity(byName(stats.getSeverity()))
                .category(byName(stats.getCategory()))
                .status(byName(stats.getStatus()))
                .build();
    }

    private static <E extends Enum<E>> Map<String, Long> byName(Map<E, Long> counts) {
        Map<String, Long> named = new LinkedHashMap<>();
        counts.forEach((key, count) -> named.put(key.name(), count));
        return named;
    }
}
