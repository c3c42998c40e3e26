package com.z254.triage.api.v1;

import com.z254.triage.api.dto.CreateIncidentRequest;
import com.z254.triage.api.dto.IncidentDto;
import com.z254.triage.api.dto.IncidentPageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for {@link IncidentController}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class IncidentControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    private IncidentDto outage;

    @BeforeEach
    void setUp() {
        outage = create("Server is down, critical outage", "Every request fails", "api-gateway");
    }

    @Nested
    @DisplayName("POST /api/v1/incidents")
    class CreateIncidentTests {

        @Test
        @DisplayName("should triage a valid report")
        void createTriagesReport() {
            webTestClient.post()
                    .uri("/api/v1/incidents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(CreateIncidentRequest.builder()
                            .title("Potential SQL injection in login")
                            .description("WAF logged unauthorized access attempts")
                            .affectedService("auth-service")
                            .build())
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody(IncidentDto.class)
                    .value(incident -> {
                        assertThat(incident.getId()).isEqualTo(2L);
                        assertThat(incident.getAiCategory()).isEqualTo("SECURITY");
                        assertThat(incident.getStatus()).isEqualTo("OPEN");
                        assertThat(incident.getAiSuggestedAction()).isNotBlank();
                        assertThat(incident.getCreatedAt()).isEqualTo(incident.getUpdatedAt());
                    });
        }

        @Test
        @DisplayName("should reject a report with missing fields")
        void createRejectsMissingFields() {
            webTestClient.post()
                    .uri("/api/v1/incidents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(CreateIncidentRequest.builder().title("Only a title").build())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Validation Failed")
                    .jsonPath("$.missingFields[0]").isEqualTo("description")
                    .jsonPath("$.missingFields[1]").isEqualTo("affectedService");

            webTestClient.get()
                    .uri("/api/v1/incidents/stats")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(1);
        }

        @Test
        @DisplayName("should reject an empty body")
        void createRejectsEmptyBody() {
            webTestClient.post()
                    .uri("/api/v1/incidents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.missingFields.length()").isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("GET /api/v1/incidents/{id}")
    class GetIncidentTests {

        @Test
        void getExistingIncident() {
            webTestClient.get()
                    .uri("/api/v1/incidents/{id}", outage.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentDto.class)
                    .isEqualTo(outage);
        }

        @Test
        void getFromUnversionedPath() {
            webTestClient.get()
                    .uri("/api/incidents/{id}", outage.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentDto.class)
                    .isEqualTo(outage);
        }

        @Test
        void getWithMalformedId() {
            webTestClient.get()
                    .uri("/api/v1/incidents/not-a-number")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Bad Request");
        }

        @Test
        void getUnknownIncident() {
            webTestClient.get()
                    .uri("/api/v1/incidents/{id}", 404)
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Incident not found: 404");
        }
    }

    @Nested
    @DisplayName("PUT /api/v1/incidents/{id}/status")
    class UpdateStatusTests {

        @Test
        void updateToKnownStatus() {
            webTestClient.put()
                    .uri("/api/v1/incidents/{id}/status?status=IN_PROGRESS", outage.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentDto.class)
                    .value(incident -> {
                        assertThat(incident.getStatus()).isEqualTo("IN_PROGRESS");
                        assertThat(incident.getUpdatedAt()).isAfterOrEqualTo(incident.getCreatedAt());
                        assertThat(incident.getAiSeverity()).isEqualTo(outage.getAiSeverity());
                    });
        }

        @Test
        void rejectBogusStatus() {
            webTestClient.put()
                    .uri("/api/v1/incidents/{id}/status?status=BOGUS", outage.getId())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Invalid status: BOGUS");

            webTestClient.get()
                    .uri("/api/v1/incidents/{id}", outage.getId())
                    .exchange()
                    .expectBody(IncidentDto.class)
                    .isEqualTo(outage);
        }

        @Test
        void rejectUnknownIncident() {
            webTestClient.put()
                    .uri("/api/v1/incidents/{id}/status?status=CLOSED", 999)
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Nested
    @DisplayName("GET /api/v1/incidents")
    class ListIncidentTests {

        @BeforeEach
        void createMore() {
            create("Checkout error", "Payment page shows an error", "checkout");
            create("Feature request", "Add dark mode", "settings");
        }

        @Test
        void listFirstPage() {
            webTestClient.get()
                    .uri("/api/v1/incidents?page=0&size=10")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentPageResponse.class)
                    .value(page -> {
                        assertThat(page.getContent()).hasSize(3);
                        assertThat(page.getNumber()).isZero();
                        assertThat(page.getSize()).isEqualTo(10);
                        assertThat(page.getTotalElements()).isEqualTo(3);
                        assertThat(page.getTotalPages()).isEqualTo(1);
                    });
        }

        @Test
        void listBySeverity() {
            webTestClient.get()
                    .uri("/api/v1/incidents?severity=CRITICAL")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentPageResponse.class)
                    .value(page -> {
                        assertThat(page.getContent()).extracting(IncidentDto::getAiSeverity).containsOnly("CRITICAL");
                        assertThat(page.getTotalElements()).isEqualTo(1);
                    });
        }

        @Test
        void listSortedById() {
            webTestClient.get()
                    .uri("/api/v1/incidents?sortBy=id&sortDir=asc&size=2&page=1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(IncidentPageResponse.class)
                    .value(page -> {
                        assertThat(page.getContent()).extracting(IncidentDto::getId).containsExactly(3L);
                        assertThat(page.getTotalPages()).isEqualTo(2);
                    });
        }

        @Test
        void statsSumToTotal() {
            webTestClient.get()
                    .uri("/api/v1/incidents/stats")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(3)
                    .jsonPath("$.severity.CRITICAL").isEqualTo(1)
                    .jsonPath("$.severity.HIGH").isEqualTo(1)
                    .jsonPath("$.severity.LOW").isEqualTo(1)
                    .jsonPath("$.severity.MEDIUM").doesNotExist()
                    .jsonPath("$.status.OPEN").isEqualTo(3);
        }
    }

    @Test
    void healthIsUp() {
        webTestClient.get()
                .uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP");
    }

    private IncidentDto create(String title, String description, String service) {
        return webTestClient.post()
                .uri("/api/v1/incidents")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CreateIncidentRequest.builder()
                        .title(title)
                        .description(description)
                        .affectedService(service)
                        .build())
                .exchange()
                .expectStatus().isCreated()
                .expectBody(IncidentDto.class)
                .returnResult()
                .getResponseBody();
    }
}
