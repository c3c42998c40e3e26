package com.z254.triage.query;

import com.z254.triage.config.TriageProperties;
import com.z254.triage.domain.model.IncidentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Filters, sorts and paginates a snapshot of incidents.
 * <p>
 * Never fails: unknown filter values match nothing, an unknown sort field falls back to
 * {@code createdAt}, and pages past the end are empty. The input collection is not modified.
 */
@Slf4j
@Component
public class IncidentQueryEngine {

    private static final String DESCENDING = "desc";

    private final TriageProperties triageProperties;

    public IncidentQueryEngine(TriageProperties triageProperties) {
        this.triageProperties = triageProperties;
    }

    public IncidentPage execute(Collection<IncidentRecord> snapshot, IncidentQuery query) {
        int page = resolvePage(query.getPage());
        int size = resolveSize(query.getSize());

        List<IncidentRecord> matching = new ArrayList<>();
        for (IncidentRecord record : snapshot) {
            if (matches(query.getSeverity(), record.getAiSeverity().name())
                    && matches(query.getCategory(), record.getAiCategory().name())) {
                matching.add(record);
            }
        }

        // List.sort is stable: ties keep snapshot order
        matching.sort(resolveComparator(query.getSortBy(), query.getSortDir()));

        long total = matching.size();
        long start = (long) page * size;
        List<IncidentRecord> content = start >= total
                ? List.of()
                : List.copyOf(matching.subList((int) start, (int) Math.min(start + size, total)));

        return IncidentPage.builder()
                .content(content)
                .number(page)
                .size(size)
                .totalElements(total)
                .totalPages((int) ((total + size - 1) / size))
                .build();
    }

    private static boolean matches(String filter, String value) {
        return filter == null || filter.isEmpty() || filter.equals(value);
    }

    private Comparator<IncidentRecord> resolveComparator(String sortBy, String sortDir) {
        IncidentSortField field = IncidentSortField.DEFAULT;
        if (sortBy != null && !sortBy.isEmpty()) {
            field = IncidentSortField.fromFieldName(sortBy).orElseGet(() -> {
                log.warn("Unsupported sort field '{}', sorting by {}", sortBy,
                        IncidentSortField.DEFAULT.getFieldName());
                return IncidentSortField.DEFAULT;
            });
        }
        boolean descending = sortDir == null || DESCENDING.equals(sortDir.toLowerCase(Locale.ROOT));
        return field.comparator(descending);
    }

    private int resolvePage(Integer page) {
        return page == null || page < 0 ? 0 : page;
    }

    private int resolveSize(Integer size) {
        if (size == null || size < 1) {
            return triageProperties.getQuery().getDefaultPageSize();
        }
        return size;
    }
}
