/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

/**
 * Enumeration of pipeline job types with their default cadence.
 *
 * <p>
 * Handler implementations register themselves with the corresponding job type for CDI discovery. Cadences are
 * overridable through {@code weather.jobs.*.every}.
 *
 * @see JobHandler for handler contract
 * @see villagecompute.weather.services.JobDispatcher for dispatch
 */
public enum JobType {

    /**
     * Fetches recent hourly history from the Open-Meteo archive into MongoDB.
     * <p>
     * <b>Cadence:</b> Every 1 hour
     * <p>
     * <b>Handler:</b> WeatherFetchJobHandler
     */
    WEATHER_FETCH("Weather fetch (1 hour)"),

    /**
     * Loads enriched MongoDB observations into ClickHouse and rebuilds {@code monthly_agg}.
     * <p>
     * <b>Cadence:</b> Every 1 hour, offset from the fetch
     * <p>
     * <b>Handler:</b> WarehouseLoadJobHandler
     */
    WAREHOUSE_LOAD("Warehouse load (1 hour)"),

    /**
     * Copies monthly aggregates for the configured cities into Redis snapshots.
     * <p>
     * <b>Cadence:</b> Every 30 minutes (half the snapshot TTL)
     * <p>
     * <b>Handler:</b> CacheRefreshJobHandler
     */
    CACHE_REFRESH("Cache refresh (30 minutes)");

    private final String description;

    JobType(String description) {
        this.description = description;
    }

    /**
     * Returns a human-readable description including the default cadence.
     *
     * @return job description
     */
    public String getDescription() {
        return description;
    }
}
