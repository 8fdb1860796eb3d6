/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import villagecompute.weather.api.types.CacheSnapshotType;

/**
 * Result of reading one snapshot key from Redis.
 *
 * <p>
 * Every non-{@link Status#HIT} outcome leads to the same warehouse fallback, but the status is kept so logs, metrics
 * and {@code /api/cache-status} can tell an absent key from a Redis outage from a corrupt payload.
 *
 * @param key
 *            Redis key that was read
 * @param status
 *            lookup outcome
 * @param snapshot
 *            parsed snapshot, only for {@link Status#HIT}
 * @param ttlSeconds
 *            remaining TTL queried at read time, only meaningful for {@link Status#HIT}
 * @param detail
 *            error description for {@link Status#UNAVAILABLE} and {@link Status#CORRUPT}, null otherwise
 */
public record CacheLookup(String key, Status status, CacheSnapshotType snapshot, long ttlSeconds, String detail) {

    /**
     * Lookup outcome.
     */
    public enum Status {

        /** Key present and value parsed. */
        HIT("hit"),

        /** Key absent or already expired. */
        MISSING("missing"),

        /** Redis could not be reached or returned a transport error. */
        UNAVAILABLE("unavailable"),

        /** Key present but the value is not a valid snapshot. */
        CORRUPT("corrupt");

        private final String wireValue;

        Status(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }

    public static CacheLookup hit(String key, CacheSnapshotType snapshot, long ttlSeconds) {
        return new CacheLookup(key, Status.HIT, snapshot, ttlSeconds, null);
    }

    public static CacheLookup missing(String key) {
        return new CacheLookup(key, Status.MISSING, null, 0, null);
    }

    public static CacheLookup unavailable(String key, String detail) {
        return new CacheLookup(key, Status.UNAVAILABLE, null, 0, detail);
    }

    public static CacheLookup corrupt(String key, String detail) {
        return new CacheLookup(key, Status.CORRUPT, null, 0, detail);
    }

    /**
     * @return true when a parsed snapshot is available
     */
    public boolean readable() {
        return status == Status.HIT && snapshot != null;
    }
}
