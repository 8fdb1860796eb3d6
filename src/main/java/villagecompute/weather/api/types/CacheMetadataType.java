/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata block written alongside every Redis snapshot.
 *
 * @param cacheTimestamp
 *            ISO-8601 instant the snapshot was written
 * @param dataVersion
 *            opaque version token, increases with every write (e.g., "v1704067200000")
 * @param refreshIntervalSec
 *            TTL in seconds configured when the snapshot was written; null if an older writer omitted it
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record CacheMetadataType(@JsonProperty("cache_timestamp") String cacheTimestamp,
        @JsonProperty("data_version") String dataVersion,
        @JsonProperty("refresh_interval_sec") Long refreshIntervalSec) {
}
