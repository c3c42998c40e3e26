package com.z254.triage.analysis;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based severity and category classifier.
 * <p>
 * Each dimension is a priority-ordered keyword cascade over the lower-cased report text:
 * the first tier with a matching keyword wins. Matching is plain substring containment,
 * so "crash" also matches "crashed". Tiers are checked in enum declaration order.
 */
@Component
public class IncidentClassifier {

    private static final Map<Severity, List<String>> SEVERITY_KEYWORDS = new EnumMap<>(Severity.class);
    private static final Map<Category, List<String>> CATEGORY_KEYWORDS = new EnumMap<>(Category.class);

    static {
        SEVERITY_KEYWORDS.put(Severity.CRITICAL, List.of(
                "down", "outage", "critical", "security breach", "data loss", "crash"));
        SEVERITY_KEYWORDS.put(Severity.HIGH, List.of(
                "error", "failure", "slow", "timeout", "unavailable"));
        SEVERITY_KEYWORDS.put(Severity.MEDIUM, List.of(
                "issue", "problem", "bug", "warning"));

        CATEGORY_KEYWORDS.put(Category.SECURITY, List.of(
                "security", "breach", "hack", "unauthorized", "vulnerability"));
        CATEGORY_KEYWORDS.put(Category.NETWORK, List.of(
                "network", "connection", "dns", "firewall", "bandwidth"));
        CATEGORY_KEYWORDS.put(Category.DATABASE, List.of(
                "database", "sql", "query", "data", "storage"));
        CATEGORY_KEYWORDS.put(Category.FRONTEND, List.of(
                "frontend", "ui", "interface", "browser", "css", "javascript"));
        CATEGORY_KEYWORDS.put(Category.HARDWARE, List.of(
                "hardware", "server", "disk", "memory", "cpu"));
    }

    /**
     * Classify severity from the title and description. Defaults to {@link Severity#LOW}.
     */
    public Severity classifySeverity(String title, String description) {
        String text = normalize(title, description);
        for (Map.Entry<Severity, List<String>> tier : SEVERITY_KEYWORDS.entrySet()) {
            if (containsAny(text, tier.getValue())) {
                return tier.getKey();
            }
        }
        return Severity.LOW;
    }

    /**
     * Classify the functional category from title, description and affected service.
     * Defaults to {@link Category#SOFTWARE}.
     */
    public Category classifyCategory(String title, String description, String affectedService) {
        String text = normalize(title, description, affectedService);
        for (Map.Entry<Category, List<String>> tier : CATEGORY_KEYWORDS.entrySet()) {
            if (containsAny(text, tier.getValue())) {
                return tier.getKey();
            }
        }
        return Category.SOFTWARE;
    }

    static String normalize(String... parts) {
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
