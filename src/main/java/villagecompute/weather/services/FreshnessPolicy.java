/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.weather.api.types.CacheMetadataType;

/**
 * Decides whether a monthly read is answered from the Redis snapshot or the ClickHouse warehouse, and how fresh the
 * answer is.
 *
 * <h2>Classification</h2>
 * <ul>
 * <li>{@code ratio = remainingTtl / refreshInterval}</li>
 * <li>ratio &lt; 0.2: {@link SyncStatus#OUT_OF_SYNC}</li>
 * <li>0.2 &le; ratio &lt; 0.6: {@link SyncStatus#PARTIAL}</li>
 * <li>ratio &ge; 0.6: {@link SyncStatus#FULL}</li>
 * <li>remaining TTL &le; 0 is always OUT_OF_SYNC</li>
 * </ul>
 * Band edges are compared in integer arithmetic so exactly 0.2 and 0.6 land in the higher band.
 *
 * <h2>Source Selection</h2>
 * Any lookup other than a parsed hit selects the warehouse with OUT_OF_SYNC. A hit selects the cache and classifies the
 * live TTL against the interval the snapshot declares, falling back to {@code weather.cache.ttl-seconds} and then to
 * {@link #DEFAULT_REFRESH_INTERVAL_SECONDS}.
 *
 * <p>
 * Pure and side-effect free: reads nothing and writes nothing, so it is safe to call from concurrent requests.
 */
@ApplicationScoped
public class FreshnessPolicy {

    private static final Logger LOG = Logger.getLogger(FreshnessPolicy.class);

    public static final long DEFAULT_REFRESH_INTERVAL_SECONDS = 3600;

    @ConfigProperty(
            name = "weather.cache.ttl-seconds",
            defaultValue = "3600")
    long configuredIntervalSeconds;

    /**
     * Outcome of source selection for one read.
     *
     * @param source
     *            store to read from
     * @param syncStatus
     *            freshness to report
     * @param ttlSeconds
     *            live TTL for cache reads, null for warehouse reads
     * @param refreshIntervalSeconds
     *            interval the classification used, null for warehouse reads
     */
    public record SourceDecision(ReadSource source, SyncStatus syncStatus, Long ttlSeconds,
            Long refreshIntervalSeconds) {
    }

    /**
     * Classifies snapshot freshness from its remaining TTL and refresh interval.
     *
     * @param remainingTtlSeconds
     *            live TTL reported by Redis; zero or negative for absent/expired keys
     * @param refreshIntervalSeconds
     *            interval the snapshot was written with; non-positive values are replaced by the default
     * @return freshness band
     */
    public SyncStatus classify(long remainingTtlSeconds, long refreshIntervalSeconds) {
        long interval = refreshIntervalSeconds;
        if (interval <= 0) {
            LOG.warnf("Invalid refresh interval %d, using default of %d seconds", refreshIntervalSeconds,
                    DEFAULT_REFRESH_INTERVAL_SECONDS);
            interval = DEFAULT_REFRESH_INTERVAL_SECONDS;
        }

        if (remainingTtlSeconds <= 0) {
            return SyncStatus.OUT_OF_SYNC;
        }

        // ratio < 0.2 <=> ttl * 5 < interval; ratio < 0.6 <=> ttl * 5 < interval * 3
        if (remainingTtlSeconds * 5 < interval) {
            return SyncStatus.OUT_OF_SYNC;
        }
        if (remainingTtlSeconds * 5 < interval * 3) {
            return SyncStatus.PARTIAL;
        }
        return SyncStatus.FULL;
    }

    /**
     * Chooses the store for a read given the outcome of the Redis lookup.
     *
     * @param lookup
     *            tagged result of reading the snapshot key
     * @return source, sync status and TTL to report
     */
    public SourceDecision selectSource(CacheLookup lookup) {
        if (lookup == null || !lookup.readable()) {
            return new SourceDecision(ReadSource.WAREHOUSE, SyncStatus.OUT_OF_SYNC, null, null);
        }

        CacheMetadataType metadata = lookup.snapshot().metadata();
        Long declared = metadata != null ? metadata.refreshIntervalSec() : null;
        long interval = declared != null && declared > 0 ? declared : effectiveInterval(configuredIntervalSeconds);

        SyncStatus status = classify(lookup.ttlSeconds(), interval);
        return new SourceDecision(ReadSource.CACHE, status, lookup.ttlSeconds(), interval);
    }

    /**
     * Returns the interval to use when a configured or declared value may be missing or invalid.
     *
     * @param seconds
     *            configured or declared interval
     * @return seconds when positive, {@link #DEFAULT_REFRESH_INTERVAL_SECONDS} otherwise
     */
    public static long effectiveInterval(long seconds) {
        return seconds > 0 ? seconds : DEFAULT_REFRESH_INTERVAL_SECONDS;
    }
}
