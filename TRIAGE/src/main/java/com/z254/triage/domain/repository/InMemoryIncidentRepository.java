package com.z254.triage.domain.repository;

import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.NewIncident;
import com.z254.triage.domain.model.TriageAssessment;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Transient in-memory repository, used until a durable store is wired up.
 * <p>
 * Writers hold the write lock while replacing a record, readers copy under the read lock.
 * Records are immutable, so a snapshot always holds whole records.
 */
@Slf4j
@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final NavigableMap<Long, IncidentRecord> store = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong idSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryIncidentRepository() {
        this(Clock.systemUTC());
    }

    @Autowired
    public InMemoryIncidentRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public IncidentRecord insert(NewIncident incident, TriageAssessment assessment) {
        lock.writeLock().lock();
        try {
            Instant now = incident.getReportedAt() != null ? incident.getReportedAt() : clock.instant();
            IncidentRecord record = IncidentRecord.builder()
                    .id(idSequence.incrementAndGet())
                    .title(incident.getTitle())
                    .description(incident.getDescription())
                    .affectedService(incident.getAffectedService())
                    .status(IncidentStatus.OPEN)
                    .aiSeverity(assessment.getSeverity())
                    .aiCategory(assessment.getCategory())
                    .aiSuggestedAction(assessment.getSuggestedAction())
                    .confidenceScore(assessment.getConfidenceScore())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            store.put(record.getId(), record);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<IncidentRecord> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(store.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IncidentRecord> findAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(store.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<IncidentRecord> updateStatus(long id, IncidentStatus status) {
        lock.writeLock().lock();
        try {
            IncidentRecord current = store.get(id);
            if (current == null) {
                return Optional.empty();
            }
            IncidentRecord updated = current.withStatus(status, clock.instant());
            store.put(id, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void close() {
        lock.writeLock().lock();
        try {
            log.info("Releasing in-memory incident store ({} incidents)", store.size());
            store.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
