package com.z254.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TRIAGE - Incident Triage Service.
 *
 * <p>TRIAGE provides:
 * <ul>
 *   <li>Severity and category classification of free-text incident reports</li>
 *   <li>Remediation advice from a fixed (severity, category) playbook table</li>
 *   <li>Confidence scoring based on the textual evidence in a report</li>
 *   <li>Paginated, filterable incident listing and aggregate statistics</li>
 * </ul>
 *
 * <p>Classification is rule-based and deterministic: the same report always
 * receives the same triage.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class TriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApplication.class, args);
    }
}
