package com.metering.fetch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI timeseriesFetchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Timeseries Fetch Service API")
                        .description("""
                                Adaptive fetch orchestrator for metering time-series.

                                **Routes:**
                                - `direct`: small requests, fetched synchronously from upstream
                                - `cached`: medium requests, served from and written to the object cache
                                - `queued`: large requests, accepted with 202 and processed by background workers

                                Queued jobs are polled through `/jobs/{jobId}` and their results read from
                                `/jobs/{jobId}/data`. Jobs that exhaust their retries land on the dead-letter
                                queue and can be inspected and requeued under `/queue/dlq`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
