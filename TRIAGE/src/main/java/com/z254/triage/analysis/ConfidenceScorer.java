package com.z254.triage.analysis;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Heuristic score of how much textual evidence backs a triage decision.
 * <p>
 * Not a calibrated probability. Computed in tenths so every result is one of
 * 0.5, 0.6, ..., 1.0 exactly.
 */
@Component
public class ConfidenceScorer {

    static final List<String> TECHNICAL_TERMS = List.of(
            "error", "exception", "timeout", "failure", "crash", "bug", "issue");

    private static final int BASE_TENTHS = 5;
    private static final int DETAILED_BONUS_TENTHS = 2;
    private static final int VERY_DETAILED_BONUS_TENTHS = 1;
    private static final int MAX_TERM_BONUS_TENTHS = 3;
    private static final int MAX_TENTHS = 10;

    private static final int DETAILED_LENGTH = 100;
    private static final int VERY_DETAILED_LENGTH = 300;

    public double score(String title, String description) {
        int tenths = BASE_TENTHS;

        if (description.length() > DETAILED_LENGTH) {
            tenths += DETAILED_BONUS_TENTHS;
        }
        if (description.length() > VERY_DETAILED_LENGTH) {
            tenths += VERY_DETAILED_BONUS_TENTHS;
        }

        String text = IncidentClassifier.normalize(title, description);
        long matchedTerms = TECHNICAL_TERMS.stream().filter(text::contains).count();
        tenths += (int) Math.min(matchedTerms, MAX_TERM_BONUS_TENTHS);

        return Math.min(tenths, MAX_TENTHS) / 10.0;
    }
}
