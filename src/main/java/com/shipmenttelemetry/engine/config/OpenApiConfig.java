package com.shipmenttelemetry.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI description of the REST facade.
 *
 * - Swagger UI: /swagger-ui.html
 * - OpenAPI JSON: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI shipmentTelemetryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shipment Telemetry Engine API")
                        .description("Turns raw device telemetry into validated shipment facts.\n\n" +
                                "## Pipeline\n\n" +
                                "1. Normalize the raw sample (units, time zone, device defaults)\n" +
                                "2. Flag physically implausible transitions (advisory only)\n" +
                                "3. Detect geofence ENTER/EXIT transitions\n" +
                                "4. Derive MT-01 milestone tokens\n" +
                                "5. Persist tokens into the shipment's lineage\n\n" +
                                "## Tokens\n\n" +
                                "ST-01 shipment, MT-01 milestone, AT-02 accessorial, QT-01 quote, " +
                                "IT-01 invoice, PT-01 payment.\n\n" +
                                "## Errors\n\n" +
                                "Every error body carries `errorKind` and `retryable`. " +
                                "RELATION_VALIDATION and PERSISTENCE are retryable with the same input.")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
