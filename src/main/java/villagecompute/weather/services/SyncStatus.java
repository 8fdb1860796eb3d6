/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

/**
 * Freshness classification of the data behind a {@code /api/monthly} response.
 *
 * <p>
 * Derived on every read from the ratio of remaining snapshot TTL to the snapshot's refresh interval; never stored.
 * <ul>
 * <li>FULL (ratio &ge; 0.6): snapshot is fresh</li>
 * <li>PARTIAL (0.2 &le; ratio &lt; 0.6): snapshot is aging but usable</li>
 * <li>OUT_OF_SYNC (ratio &lt; 0.2, expired, or served from the warehouse): consumers should expect a refresh</li>
 * </ul>
 *
 * @see FreshnessPolicy#classify(long, long)
 */
public enum SyncStatus {

    FULL("full"),

    PARTIAL("partial"),

    OUT_OF_SYNC("out-of-sync");

    private final String wireValue;

    SyncStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * @return value used in JSON responses (e.g., "out-of-sync")
     */
    public String wireValue() {
        return wireValue;
    }
}
