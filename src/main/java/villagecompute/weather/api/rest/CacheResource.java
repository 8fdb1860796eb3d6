/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import java.time.Clock;

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
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.weather.api.types.CacheSnapshotType;
import villagecompute.weather.api.types.CacheStatusType;
import villagecompute.weather.api.types.SyncResultType;
import villagecompute.weather.exceptions.CacheUnavailableException;
import villagecompute.weather.exceptions.WarehouseException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.services.CacheRefreshService;
import villagecompute.weather.services.MonthlyAggregateService;

/**
 * REST endpoints for inspecting and refreshing the Redis snapshot.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/cache-status?city=} – key, live TTL and lookup outcome of a city's snapshot</li>
 * <li>{@code POST /api/sync-now?city=} – rebuild the snapshot from ClickHouse immediately</li>
 * </ul>
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Cache",
        description = "Redis snapshot status and refresh operations")
public class CacheResource {

    private static final Logger LOG = Logger.getLogger(CacheResource.class);

    @Inject
    MonthlyAggregateService monthlyAggregateService;

    @Inject
    CacheRefreshService cacheRefreshService;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "weather.default-city",
            defaultValue = "Stockton")
    String defaultCity;

    /**
     * Reports the snapshot state for a city.
     *
     * @param city
     *            city name, defaults to {@code weather.default-city}
     * @return 200 with cache status; Redis failures are reported in the body
     */
    @GET
    @Path("/cache-status")
    @Operation(
            summary = "Get cache status",
            description = "Key, remaining TTL and lookup outcome (hit, missing, unavailable, corrupt) of a snapshot")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Cache status returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CacheStatusType.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "Failed to check cache status",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response getCacheStatus(@Parameter(
            description = "City name") @QueryParam("city") String city) {
        String target = resolveCity(city);
        try {
            return Response.ok(monthlyAggregateService.getCacheStatus(target)).build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to check cache status for %s", target);
            return ErrorResponses.unexpected("Failed to check cache status", e);
        }
    }

    /**
     * Rebuilds the snapshot for a city from the warehouse.
     *
     * @param city
     *            city name, defaults to {@code weather.default-city}
     * @return 200 on success, 503 if ClickHouse or Redis is unreachable, 500 otherwise
     */
    @POST
    @Path("/sync-now")
    @Operation(
            summary = "Refresh cache now",
            description = "Runs the cache refresh for one city synchronously and resets its TTL")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Snapshot rewritten",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SyncResultType.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "Refresh failed",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = SyncResultType.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "ClickHouse or Redis unreachable",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = SyncResultType.class)))})
    public Response syncNow(@Parameter(
            description = "City name") @QueryParam("city") String city) {
        String target = resolveCity(city);
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/api/sync-now");
        LoggingConfig.setCity(target);

        try {
            CacheSnapshotType snapshot = cacheRefreshService.refresh(target);
            return Response.ok(new SyncResultType(true, "Redis cache refreshed successfully from ClickHouse", target,
                    clock.instant().toString(), snapshot.data().size(), snapshot.metadata().dataVersion())).build();

        } catch (WarehouseException e) {
            Response.Status status = e instanceof WarehouseUnavailableException
                    ? Response.Status.SERVICE_UNAVAILABLE
                    : Response.Status.INTERNAL_SERVER_ERROR;
            return failure(status, target, e.getMessage() + ". " + e.helpfulMessage());
        } catch (CacheUnavailableException e) {
            return failure(Response.Status.SERVICE_UNAVAILABLE, target, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error refreshing cache for %s", target);
            return failure(Response.Status.INTERNAL_SERVER_ERROR, target, e.getMessage());
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private Response failure(Response.Status status, String city, String message) {
        return Response.status(status)
                .entity(new SyncResultType(false, "Cache refresh failed: " + message, city, clock.instant().toString(),
                        null, null))
                .build();
    }

    private String resolveCity(String city) {
        return city == null || city.isBlank() ? defaultCity : city.trim();
    }
}
