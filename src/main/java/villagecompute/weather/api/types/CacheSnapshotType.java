/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Serialized value stored under {@code weather:{team}:{city}:monthly} in Redis.
 *
 * <p>
 * Written in one {@code SETEX} by the cache refresh job and never mutated afterwards, so readers always see either the
 * previous or the next snapshot in full.
 *
 * @param team
 *            deployment tag that owns the key
 * @param city
 *            city the snapshot covers, as requested by the refresh
 * @param metric
 *            always "monthly_agg"
 * @param data
 *            monthly aggregates ordered by month ascending; empty when the warehouse has no rows for the city
 * @param metadata
 *            write timestamp, version and refresh interval
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record CacheSnapshotType(String team, String city, String metric, List<MonthlyAggregateType> data,
        CacheMetadataType metadata) {
}
