/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Service name, version and endpoint catalogue.
 */
@Path("/api")
@Tag(
        name = "Health",
        description = "Health check operations")
public class ApiIndexResource {

    static final String NAME = "Weather Pipeline API";
    static final String VERSION = "1.0.0";

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "List endpoints",
            description = "Service name, version and endpoint catalogue")
    public ApiIndexResponse index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /api/monthly", "Get monthly aggregated weather data");
        endpoints.put("GET /api/cache-status", "Get Redis cache status");
        endpoints.put("POST /api/sync-now", "Trigger cache refresh");
        endpoints.put("GET /api/diagnostics", "Run ClickHouse diagnostics");
        endpoints.put("GET /health", "Health check endpoint");
        return new ApiIndexResponse(NAME, VERSION, endpoints);
    }

    public record ApiIndexResponse(String name, String version, Map<String, String> endpoints) {
    }
}
