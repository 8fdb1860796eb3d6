/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

/**
 * Store a monthly read is answered from.
 */
public enum ReadSource {

    /**
     * Redis snapshot written by the cache refresh job.
     */
    CACHE("cache"),

    /**
     * ClickHouse {@code weather_dw.monthly_agg}, the source of truth.
     */
    WAREHOUSE("warehouse");

    private final String wireValue;

    ReadSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
