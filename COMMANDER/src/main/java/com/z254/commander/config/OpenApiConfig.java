package com.z254.commander.config;

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
 * OpenAPI documentation configuration for COMMANDER.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI commanderOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("COMMANDER Incident Orchestration API")
                        .description("""
                                COMMANDER drives incidents through the detection, diagnosis,
                                prediction and resolution phases and streams every agent
                                transition to operations dashboards.

                                ## Streaming

                                Dashboards connect to `/dashboard/ws` and receive batched
                                `agent_update`, `incident_flow`, `system_health` and
                                `error_notification` messages.

                                ## REST

                                The endpoints below expose broadcast and orchestration metrics.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Incident Commander Team"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Dashboard")
                                .description("Broadcast layer and system health metrics")
                ));
    }
}
