/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import villagecompute.weather.api.types.DiagnosticsType;
import villagecompute.weather.services.DiagnosticsService;

/**
 * Staged ClickHouse health report. Always answers 200; failures are reported per check.
 */
@Path("/api/diagnostics")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Diagnostics",
        description = "Warehouse diagnostics")
public class DiagnosticsResource {

    @Inject
    DiagnosticsService diagnosticsService;

    @ConfigProperty(
            name = "weather.default-city",
            defaultValue = "Stockton")
    String defaultCity;

    @GET
    @Operation(
            summary = "Run warehouse diagnostics",
            description = "Checks connection, database, table, row count and a sample query, "
                    + "stopping at the first blocking problem")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Diagnostics report",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DiagnosticsType.class)))})
    public DiagnosticsType diagnostics(@Parameter(
            description = "City used for the sample query") @QueryParam("city") String city) {
        return diagnosticsService.run(city == null || city.isBlank() ? defaultCity : city.trim());
    }
}
