package com.z254.triage.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the TRIAGE service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Incident list paging limits</li>
 *     <li>Sample incident seeding</li>
 *     <li>Structured logging thresholds</li>
 *     <li>CORS origins for browser clients</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private final Query query = new Query();
    private final Seed seed = new Seed();
    private final Logging logging = new Logging();
    private final Cors cors = new Cors();

    /**
     * Incident list paging.
     */
    @Data
    public static class Query {
        /** Page size used when none (or a non-positive one) is requested */
        @Positive
        private int defaultPageSize = 10;
    }

    /**
     * Sample incidents loaded at startup.
     */
    @Data
    public static class Seed {
        private boolean enabled = true;
    }

    @Data
    public static class Logging {
        /** Operations slower than this are logged at WARN */
        private Duration slowOperationThreshold = Duration.ofMillis(500);
    }

    @Data
    public static class Cors {
        @NotEmpty
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
