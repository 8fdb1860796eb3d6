/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import java.time.Clock;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Liveness endpoint reporting the configured warehouse URL.
 */
@Path("/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "quarkus.datasource.jdbc.url",
            defaultValue = "jdbc:clickhouse://localhost:8123/default")
    String warehouseUrl;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Check if the application is running")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Application is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class)))})
    public HealthResponse health() {
        return new HealthResponse("ok", clock.instant().toString(), warehouseUrl);
    }

    public record HealthResponse(String status, String timestamp, @JsonProperty("warehouse_url") String warehouseUrl) {
    }
}
