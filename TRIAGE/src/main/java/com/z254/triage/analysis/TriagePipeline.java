package com.z254.triage.analysis;

import com.z254.triage.domain.exception.IncidentValidationException;
import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.NewIncident;
import com.z254.triage.domain.model.Severity;
import com.z254.triage.domain.model.TriageAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a new incident report and computes its triage annotations.
 * <p>
 * Runs exactly once per incident, before it is stored. Stored annotations are never
 * recomputed, so later rule changes do not rewrite past decisions.
 */
@Slf4j
@Component
public class TriagePipeline {

    private final IncidentClassifier classifier;
    private final ActionRecommender actionRecommender;
    private final ConfidenceScorer confidenceScorer;

    public TriagePipeline(IncidentClassifier classifier,
                          ActionRecommender actionRecommender,
                          ConfidenceScorer confidenceScorer) {
        this.classifier = classifier;
        this.actionRecommender = actionRecommender;
        this.confidenceScorer = confidenceScorer;
    }

    /**
     * Triage a new incident.
     *
     * @throws IncidentValidationException if title, description or affected service is missing or empty
     */
    public TriageAssessment assess(NewIncident incident) {
        validate(incident);

        Severity severity = classifier.classifySeverity(incident.getTitle(), incident.getDescription());
        Category category = classifier.classifyCategory(
                incident.getTitle(), incident.getDescription(), incident.getAffectedService());
        String action = actionRecommender.recommend(severity, category);
        double confidence = confidenceScorer.score(incident.getTitle(), incident.getDescription());

        log.debug("Triaged '{}' as {}/{} (confidence {})",
                incident.getTitle(), severity, category, confidence);

        return TriageAssessment.builder()
                .severity(severity)
                .category(category)
                .suggestedAction(action)
                .confidenceScore(confidence)
                .build();
    }

    private void validate(NewIncident incident) {
        List<String> missing = new ArrayList<>();
        if (incident == null || isEmpty(incident.getTitle())) {
            missing.add("title");
        }
        if (incident == null || isEmpty(incident.getDescription())) {
            missing.add("description");
        }
        if (incident == null || isEmpty(incident.getAffectedService())) {
            missing.add("affectedService");
        }
        if (!missing.isEmpty()) {
            throw new IncidentValidationException(missing);
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
