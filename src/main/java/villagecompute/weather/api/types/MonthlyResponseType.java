/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of {@code GET /api/monthly}.
 *
 * @param data
 *            monthly aggregates ordered by month ascending
 * @param source
 *            "cache" or "warehouse"
 * @param lastUpdated
 *            snapshot write time for cache reads, response time for warehouse reads
 * @param cacheStatus
 *            "active" when served from Redis, "none" otherwise
 * @param syncStatus
 *            "full", "partial" or "out-of-sync"
 * @param ttlSeconds
 *            remaining snapshot TTL, omitted for warehouse reads
 * @param count
 *            number of rows in {@code data}
 * @param cacheLookup
 *            outcome of the Redis lookup: "hit", "missing", "unavailable" or "corrupt"
 * @param message
 *            explanation when no rows were found, omitted otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonthlyResponseType(List<MonthlyAggregateType> data, String source,
        @JsonProperty("last_updated") String lastUpdated, @JsonProperty("cache_status") String cacheStatus,
        @JsonProperty("sync_status") String syncStatus, @JsonProperty("ttl_seconds") Long ttlSeconds, int count,
        @JsonProperty("cache_lookup") String cacheLookup, String message) {
}
