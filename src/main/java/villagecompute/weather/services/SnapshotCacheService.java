/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.CacheSnapshotType;
import villagecompute.weather.data.SnapshotStore;
import villagecompute.weather.exceptions.CacheUnavailableException;

/**
 * Reads and writes monthly snapshots in the Redis freshness cache.
 *
 * <h2>Key Format</h2>
 * {@code weather:{team}:{city-lowercased}:monthly}
 *
 * <h2>Lookup Outcomes</h2>
 * <ul>
 * <li>HIT: value parsed and live TTL read</li>
 * <li>MISSING: key absent or expired</li>
 * <li>UNAVAILABLE: Redis transport failure on GET or TTL</li>
 * <li>CORRUPT: stored value is not a snapshot</li>
 * </ul>
 * Lookups never throw. Writes propagate {@link CacheUnavailableException} so the refresh job can report failure.
 */
@ApplicationScoped
public class SnapshotCacheService {

    private static final Logger LOG = Logger.getLogger(SnapshotCacheService.class);

    public static final String METRIC = "monthly_agg";

    static final String KEY_SUFFIX = "monthly";

    @Inject
    SnapshotStore snapshotStore;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather.team-name",
            defaultValue = "UnknownTeam")
    String teamName;

    /**
     * Builds the cache key for a city.
     *
     * @param city
     *            city name in any case
     * @return Redis key
     */
    public String key(String city) {
        return "weather:" + teamName + ":" + city.toLowerCase(Locale.ROOT) + ":" + KEY_SUFFIX;
    }

    /**
     * @return deployment tag embedded in keys and snapshots
     */
    public String teamName() {
        return teamName;
    }

    /**
     * Reads the snapshot for a city together with its live TTL.
     *
     * @param city
     *            city name
     * @return tagged lookup result
     */
    public CacheLookup lookup(String city) {
        String key = key(city);

        Optional<String> raw;
        try {
            raw = snapshotStore.get(key);
        } catch (CacheUnavailableException e) {
            LOG.warnf("Redis unavailable reading %s: %s", key, e.getMessage());
            return record(CacheLookup.unavailable(key, e.getMessage()));
        }

        if (raw.isEmpty()) {
            LOG.debugf("Snapshot %s not found", key);
            return record(CacheLookup.missing(key));
        }

        CacheSnapshotType snapshot;
        try {
            snapshot = objectMapper.readValue(raw.get(), CacheSnapshotType.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Snapshot %s is not valid JSON: %s", key, e.getOriginalMessage());
            return record(CacheLookup.corrupt(key, "Stored value is not a valid snapshot"));
        }
        if (snapshot == null) {
            return record(CacheLookup.corrupt(key, "Stored value is empty"));
        }
        if (snapshot.data() == null) {
            snapshot = new CacheSnapshotType(snapshot.team(), snapshot.city(), snapshot.metric(), List.of(),
                    snapshot.metadata());
        }
        if (snapshot.data().stream().anyMatch(row -> row == null || row.city() == null || row.month() == null)) {
            LOG.warnf("Snapshot %s has rows without city or month", key);
            return record(CacheLookup.corrupt(key, "Stored snapshot contains incomplete rows"));
        }

        long ttl;
        try {
            ttl = snapshotStore.ttlSeconds(key);
        } catch (CacheUnavailableException e) {
            LOG.warnf("Redis unavailable reading TTL of %s: %s", key, e.getMessage());
            return record(CacheLookup.unavailable(key, e.getMessage()));
        }

        return record(CacheLookup.hit(key, snapshot, ttl));
    }

    /**
     * Overwrites the snapshot for its city and sets the expiry in the same command.
     *
     * @param snapshot
     *            snapshot to store
     * @param ttlSeconds
     *            expiry in seconds
     * @return key written
     * @throws CacheUnavailableException
     *             if Redis cannot be reached
     */
    public String write(CacheSnapshotType snapshot, long ttlSeconds) {
        String key = key(snapshot.city());
        String value;
        try {
            value = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot for " + key, e);
        }
        snapshotStore.setWithExpiry(key, value, ttlSeconds);
        LOG.debugf("Wrote snapshot %s with %d rows, ttl=%ds", key, snapshot.data().size(), ttlSeconds);
        return key;
    }

    private CacheLookup record(CacheLookup lookup) {
        Counter.builder("weather.cache.lookup").tag("status", lookup.status().wireValue()).register(meterRegistry)
                .increment();
        return lookup;
    }
}
