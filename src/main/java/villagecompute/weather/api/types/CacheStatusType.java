/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of {@code GET /api/cache-status}.
 *
 * @param cacheValid
 *            true when a parseable snapshot exists for the key
 * @param ttlSeconds
 *            remaining TTL in seconds (0 when absent)
 * @param ttlMinutes
 *            remaining TTL in whole minutes
 * @param key
 *            Redis key that was inspected
 * @param source
 *            "cache" when present, "none" when absent, "error" when Redis failed or the value is corrupt
 * @param cacheLookup
 *            outcome of the Redis lookup: "hit", "missing", "unavailable" or "corrupt"
 * @param metadata
 *            snapshot metadata, only when valid
 * @param dataCount
 *            number of rows in the snapshot, only when valid
 * @param message
 *            operator hint when the snapshot is not usable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStatusType(@JsonProperty("cache_valid") boolean cacheValid,
        @JsonProperty("ttl_seconds") long ttlSeconds, @JsonProperty("ttl_minutes") long ttlMinutes, String key,
        String source, @JsonProperty("cache_lookup") String cacheLookup, CacheMetadataType metadata,
        @JsonProperty("data_count") Integer dataCount, String message) {
}
