package com.z254.triage.domain.repository;

import com.z254.triage.domain.model.IncidentRecord;
import com.z254.triage.domain.model.IncidentStatus;
import com.z254.triage.domain.model.NewIncident;
import com.z254.triage.domain.model.TriageAssessment;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for incident persistence.
 * <p>
 * Identifiers and triage fields are write-once; only status and the update
 * timestamp change after insert.
 */
public interface IncidentRepository {

    /**
     * Store a triaged incident under the next identifier, stamping both timestamps.
     */
    IncidentRecord insert(NewIncident incident, TriageAssessment assessment);

    /**
     * Look up an incident by ID.
     */
    Optional<IncidentRecord> findById(long id);

    /**
     * Snapshot of all incidents in identifier order. Later writes never show up in a
     * returned list.
     */
    List<IncidentRecord> findAll();

    /**
     * Replace the status of an incident and stamp its update time.
     *
     * @return the updated incident, or empty if no incident has this ID
     */
    Optional<IncidentRecord> updateStatus(long id, IncidentStatus status);

    /**
     * Number of stored incidents.
     */
    int count();
}
