package com.z254.triage.stats;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class IncidentStatsAggregatorTest {

    private final IncidentStatsAggregator aggregator = new IncidentStatsAggregator();

    @Test
    void countsEachDimension() {
        List<IncidentRecord> incidents = List.of(
                record(1, Severity.CRITICAL, Category.SECURITY, IncidentStatus.OPEN),
                record(2, Severity.CRITICAL, Category.NETWORK, IncidentStatus.OPEN),
                record(3, Severity.LOW, Category.SECURITY, IncidentStatus.CLOSED),
                record(4, Severity.HIGH, Category.DATABASE, IncidentStatus.IN_PROGRESS));

        IncidentStats stats = aggregator.aggregate(incidents);

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getSeverity()).containsOnly(
                entry(Severity.CRITICAL, 2L), entry(Severity.HIGH, 1L), entry(Severity.LOW, 1L));
        assertThat(stats.getCategory()).containsOnly(
                entry(Category.SECURITY, 2L), entry(Category.NETWORK, 1L), entry(Category.DATABASE, 1L));
        assertThat(stats.getStatus()).containsOnly(
                entry(IncidentStatus.OPEN, 2L), entry(IncidentStatus.CLOSED, 1L), entry(IncidentStatus.IN_PROGRESS, 1L));
    }

    @Test
    void zeroCountsAreAbsentAndTablesSumToTotal() {
        List<IncidentRecord> incidents = List.of(
                record(1, Severity.MEDIUM, Category.FRONTEND, IncidentStatus.RESOLVED),
                record(2, Severity.MEDIUM, Category.FRONTEND, IncidentStatus.RESOLVED));

        IncidentStats stats = aggregator.aggregate(incidents);

        assertThat(stats.getSeverity()).doesNotContainKey(Severity.CRITICAL);
        assertThat(stats.getSeverity().values().stream().mapToLong(Long::longValue).sum()).isEqualTo(2);
        assertThat(stats.getCategory().values().stream().mapToLong(Long::longValue).sum()).isEqualTo(2);
        assertThat(stats.getStatus().values().stream().mapToLong(Long::longValue).sum()).isEqualTo(2);
    }

    @Test
    void emptyCollection() {
        IncidentStats stats = aggregator.aggregate(List.of());

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getSeverity()).isEmpty();
        assertThat(stats.getCategory()).isEmpty();
        assertThat(stats.getStatus()).isEmpty();
    }

    private static IncidentRecord record(long id, Severity severity, Category category, IncidentStatus status) {
        Instant now = Instant.parse("2025-05-01T12:00:00Z");
        return IncidentRecord.builder()
                .id(id)
                .title("Incident " + id)
                .description("Description")
                .affectedService("svc")
                .status(status)
                .aiSeverity(severity)
                .aiCategory(category)
                .aiSuggestedAction("Action")
                .confidenceScore(0.5)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
