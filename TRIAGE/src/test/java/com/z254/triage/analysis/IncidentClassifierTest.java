package com.z254.triage.analysis;

import com.z254.triage.domain.model.Category;
import com.z254.triage.domain.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentClassifierTest {

    private final IncidentClassifier classifier = new IncidentClassifier();

    @Nested
    @DisplayName("severity")
    class SeverityTests {

        @Test
        @DisplayName("outage keywords are CRITICAL")
        void outageIsCritical() {
            assertThat(classifier.classifySeverity("Server is down, critical outage", "anything"))
                    .isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("keywords match inside longer words")
        void substringMatch() {
            assertThat(classifier.classifySeverity("Worker crashed", "Restarted by supervisor"))
                    .isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("matching ignores case")
        void caseInsensitive() {
            assertThat(classifier.classifySeverity("DATA LOSS in exports", "See ticket"))
                    .isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("degradation keywords are HIGH")
        void degradationIsHigh() {
            assertThat(classifier.classifySeverity("Checkout error", "Payment request returns an error page"))
                    .isEqualTo(Severity.HIGH);
        }

        @Test
        @DisplayName("generic issue keywords are MEDIUM")
        void genericIssueIsMedium() {
            assertThat(classifier.classifySeverity("Minor problem with export", "The export button has a bug"))
                    .isEqualTo(Severity.MEDIUM);
        }

        @Test
        @DisplayName("no keywords is LOW")
        void noKeywordsIsLow() {
            assertThat(classifier.classifySeverity("Feature request", "Please add dark mode to settings page"))
                    .isEqualTo(Severity.LOW);
        }

        @Test
        @DisplayName("higher tier wins when several match")
        void firstTierWins() {
            assertThat(classifier.classifySeverity("Database error caused outage", "warning: bug"))
                    .isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("'security' alone is not a breach")
        void securityAloneIsNotCritical() {
            assertThat(classifier.classifySeverity("Security review", "Quarterly security review scheduled"))
                    .isEqualTo(Severity.LOW);
            assertThat(classifier.classifySeverity("Security breach", "Reported by customer"))
                    .isEqualTo(Severity.CRITICAL);
        }
    }

    @Nested
    @DisplayName("category")
    class CategoryTests {

        @Test
        @DisplayName("security outranks database")
        void securityBeforeDatabase() {
            assertThat(classifier.classifyCategory("Potential SQL injection in login",
                    "Attempted unauthorized access detected", "auth-service"))
                    .isEqualTo(Category.SECURITY);
        }

        @Test
        void network() {
            assertThat(classifier.classifyCategory("DNS resolution failing",
                    "Lookups for internal hosts fail", "edge-proxy"))
                    .isEqualTo(Category.NETWORK);
            assertThat(classifier.classifyCategory("FIREWALL rule dropped", "Traffic blocked", "gateway"))
                    .isEqualTo(Category.NETWORK);
        }

        @Test
        void database() {
            assertThat(classifier.classifyCategory("Slow query on orders table",
                    "Reports take minutes", "reporting"))
                    .isEqualTo(Category.DATABASE);
        }

        @Test
        void frontend() {
            assertThat(classifier.classifyCategory("Button misaligned in browser",
                    "Checkout button overlaps footer", "web-app"))
                    .isEqualTo(Category.FRONTEND);
        }

        @Test
        void hardware() {
            assertThat(classifier.classifyCategory("Disk full on node 7",
                    "Node ran out of space", "batch-worker"))
                    .isEqualTo(Category.HARDWARE);
        }

        @Test
        @DisplayName("defaults to SOFTWARE")
        void software() {
            assertThat(classifier.classifyCategory("Report export fails",
                    "Exporting PDF throws exception", "reporting"))
                    .isEqualTo(Category.SOFTWARE);
        }

        @Test
        @DisplayName("affected service takes part in matching")
        void affectedServiceCounts() {
            assertThat(classifier.classifyCategory("Latency spike", "p99 up", "primary-database"))
                    .isEqualTo(Category.DATABASE);
        }

        @Test
        @DisplayName("no word boundaries: 'build' contains 'ui'")
        void noWordBoundaries() {
            assertThat(classifier.classifyCategory("Nightly build broken", "Pipeline halts", "ci-runner"))
                    .isEqualTo(Category.FRONTEND);
        }
    }
}
