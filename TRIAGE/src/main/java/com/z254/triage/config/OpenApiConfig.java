package com.z254.triage.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the TRIAGE service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI triageOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TRIAGE Incident Triage Service API")
                        .description("""
                                TRIAGE attaches automated triage metadata to incident reports.
                                
                                ## Features
                                
                                - **Classification**: Severity tier and functional category from report text
                                - **Remediation advice**: Recommended action per (severity, category)
                                - **Confidence scoring**: How much textual evidence backs the triage
                                - **Querying**: Paginated, filterable, sortable incident lists and statistics
                                
                                Classification is rule-based and deterministic.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Incident Triage Team")
                                .email("triage@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://triage-service:8080")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Incidents")
                                .description("Incident intake, triage and querying")
                ));
    }
}
