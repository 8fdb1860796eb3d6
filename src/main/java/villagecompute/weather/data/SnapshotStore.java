/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.util.Optional;

import villagecompute.weather.exceptions.CacheUnavailableException;

/**
 * Key-value store holding serialized cache snapshots with a native expiry.
 *
 * <p>
 * Every operation is a single store command. Writes replace the whole value and reset its TTL atomically, so readers
 * see either the old or the new value, never a mix.
 *
 * @see RedisSnapshotStore
 */
public interface SnapshotStore {

    /**
     * TTL reported for a key that does not exist.
     */
    long TTL_KEY_MISSING = -2;

    /**
     * TTL reported for a key that exists without an expiry.
     */
    long TTL_NO_EXPIRY = -1;

    /**
     * Reads the raw value stored under a key.
     *
     * @param key
     *            snapshot key
     * @return the value, or empty if the key is absent or expired
     * @throws CacheUnavailableException
     *             if the store cannot be reached
     */
    Optional<String> get(String key);

    /**
     * Returns the remaining time-to-live of a key.
     *
     * @param key
     *            snapshot key
     * @return remaining seconds, {@link #TTL_KEY_MISSING} or {@link #TTL_NO_EXPIRY}
     * @throws CacheUnavailableException
     *             if the store cannot be reached
     */
    long ttlSeconds(String key);

    /**
     * Stores a value and sets its expiry in one command.
     *
     * @param key
     *            snapshot key
     * @param value
     *            serialized snapshot
     * @param ttlSeconds
     *            expiry in seconds, must be positive
     * @throws CacheUnavailableException
     *             if the store cannot be reached
     */
    void setWithExpiry(String key, String value, long ttlSeconds);
}
