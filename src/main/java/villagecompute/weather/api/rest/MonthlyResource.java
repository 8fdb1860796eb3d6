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
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weather.api.types.ErrorResponseType;
import villagecompute.weather.api.types.MonthlyResponseType;
import villagecompute.weather.exceptions.WarehouseException;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.services.MonthlyAggregateService;

/**
 * REST endpoint for monthly weather aggregates.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/monthly?city=Stockton} – monthly average temperature and total rainfall</li>
 * </ul>
 *
 * <p>
 * <b>Caching:</b> Served from the Redis snapshot when it is readable, tagged with {@code sync_status} derived from the
 * remaining TTL. Any cache problem falls back to ClickHouse with {@code sync_status=out-of-sync}.
 *
 * <p>
 * <b>Response Format:</b>
 *
 * <pre>
 * {
 *   "data": [ { "city": "Stockton", "month": "2024-01-01", "avg_temp_c": 10.0, ... } ],
 *   "source": "cache",
 *   "last_updated": "2025-01-09T10:00:00Z",
 *   "cache_status": "active",
 *   "sync_status": "full",
 *   "ttl_seconds": 3540,
 *   "count": 3,
 *   "cache_lookup": "hit"
 * }
 * </pre>
 */
@Path("/api/monthly")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Monthly",
        description = "Monthly weather aggregate operations")
public class MonthlyResource {

    private static final Logger LOG = Logger.getLogger(MonthlyResource.class);

    @Inject
    MonthlyAggregateService monthlyAggregateService;

    @ConfigProperty(
            name = "weather.default-city",
            defaultValue = "Stockton")
    String defaultCity;

    /**
     * Returns monthly aggregates for a city.
     *
     * @param city
     *            city name, defaults to {@code weather.default-city}
     * @return 200 with data (possibly empty), 503 if ClickHouse is unreachable, 500 on other warehouse errors
     */
    @GET
    @Operation(
            summary = "Get monthly aggregates",
            description = "Monthly average temperature and total rainfall, served from the Redis snapshot "
                    + "or ClickHouse")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Aggregates returned (data may be empty)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = MonthlyResponseType.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "Warehouse schema missing or query failed",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Warehouse unreachable",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class)))})
    public Response getMonthly(@Parameter(
            description = "City name") @QueryParam("city") String city) {
        String target = city == null || city.isBlank() ? defaultCity : city.trim();
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/api/monthly");
        LoggingConfig.setCity(target);

        try {
            return Response.ok(monthlyAggregateService.getMonthly(target)).build();
        } catch (WarehouseException e) {
            LOG.errorf(e, "Failed to fetch monthly data for %s", target);
            return ErrorResponses.warehouse("Failed to fetch monthly weather data", e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error fetching monthly data for %s", target);
            return ErrorResponses.unexpected("Failed to fetch monthly weather data", e);
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
