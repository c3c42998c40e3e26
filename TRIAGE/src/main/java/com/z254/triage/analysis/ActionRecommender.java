package com.z254.triage.analysis;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Remediation advice table indexed by (severity, category).
 * <p>
 * The table covers the full cross-product today; any pair without an entry
 * receives {@link #FALLBACK_ACTION}.
 */
@Component
public class ActionRecommender {

    public static final String FALLBACK_ACTION =
            "Review incident details and assign to appropriate team for investigation.";

    private final Map<Severity, Map<Category, String>> actions = new EnumMap<>(Severity.class);

    public ActionRecommender() {
        initializeActions();
    }

    /**
     * Look up the recommended action for a triaged incident.
     */
    public String recommend(Severity severity, Category category) {
        Map<Category, String> bySeverity = actions.get(severity);
        if (bySeverity == null) {
            return FALLBACK_ACTION;
        }
        return bySeverity.getOrDefault(category, FALLBACK_ACTION);
    }

    private void initializeActions() {
        register(Severity.CRITICAL, Category.SECURITY,
                "Immediately isolate affected systems, notify security team, and begin incident response protocol.");
        register(Severity.CRITICAL, Category.NETWORK,
                "Check network infrastructure, contact ISP if needed, and implement backup connectivity.");
        register(Severity.CRITICAL, Category.DATABASE,
                "Stop all write operations, check database integrity, and restore from latest backup if necessary.");
        register(Severity.CRITICAL, Category.FRONTEND,
                "Deploy rollback immediately, notify users of service disruption, and investigate root cause.");
        register(Severity.CRITICAL, Category.HARDWARE,
                "Replace failed hardware components immediately and check for data corruption.");
        register(Severity.CRITICAL, Category.SOFTWARE,
                "Rollback to previous stable version and investigate critical bug in isolated environment.");

        register(Severity.HIGH, Category.SECURITY,
                "Review security logs, patch vulnerabilities, and monitor for suspicious activity.");
        register(Severity.HIGH, Category.NETWORK,
                "Investigate network performance issues and optimize routing if needed.");
        register(Severity.HIGH, Category.DATABASE,
                "Optimize slow queries, check database performance metrics, and consider scaling.");
        register(Severity.HIGH, Category.FRONTEND,
                "Fix UI issues, test thoroughly, and deploy patch to production.");
        register(Severity.HIGH, Category.HARDWARE,
                "Monitor hardware health, schedule maintenance, and prepare replacement if needed.");
        register(Severity.HIGH, Category.SOFTWARE,
                "Debug the issue, implement fix, and test in staging environment before deployment.");

        register(Severity.MEDIUM, Category.SECURITY,
                "Schedule security audit and update security policies as needed.");
        register(Severity.MEDIUM, Category.NETWORK,
                "Monitor network performance and plan infrastructure improvements.");
        register(Severity.MEDIUM, Category.DATABASE,
                "Review database performance and plan optimization tasks.");
        register(Severity.MEDIUM, Category.FRONTEND,
                "Add to development backlog and prioritize based on user impact.");
        register(Severity.MEDIUM, Category.HARDWARE,
                "Schedule routine maintenance and monitor system health.");
        register(Severity.MEDIUM, Category.SOFTWARE,
                "Create bug ticket and assign to development team for next sprint.");

        register(Severity.LOW, Category.SECURITY,
                "Document security concern and review during next security meeting.");
        register(Severity.LOW, Category.NETWORK,
                "Monitor and document for trend analysis.");
        register(Severity.LOW, Category.DATABASE,
                "Add to maintenance backlog for future optimization.");
        register(Severity.LOW, Category.FRONTEND,
                "Consider as enhancement for future releases.");
        register(Severity.LOW, Category.HARDWARE,
                "Note for next maintenance window.");
        register(Severity.LOW, Category.SOFTWARE,
                "Add to backlog as low-priority improvement.");
    }

    private void register(Severity severity, Category category, String action) {
        actions.computeIfAbsent(severity, s -> new EnumMap<>(Category.class)).put(category, action);
    }
}
