/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.keys.KeyCommands;
import io.quarkus.redis.datasource.keys.RedisKeyNotFoundException;
import io.quarkus.redis.datasource.value.ValueCommands;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.exceptions.CacheUnavailableException;

/**
 * {@link SnapshotStore} backed by the Quarkus Redis client.
 *
 * <p>
 * Uses the pooled connection of the injected {@link RedisDataSource}. Transport failures are wrapped in
 * {@link CacheUnavailableException}.
 */
@ApplicationScoped
public class RedisSnapshotStore implements SnapshotStore {

    private static final Logger LOG = Logger.getLogger(RedisSnapshotStore.class);

    private final ValueCommands<String, String> values;
    private final KeyCommands<String> keys;

    @Inject
    public RedisSnapshotStore(RedisDataSource redis) {
        this.values = redis.value(String.class);
        this.keys = redis.key();
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(values.get(key));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis GET failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long ttlSeconds(String key) {
        try {
            return keys.ttl(key);
        } catch (RedisKeyNotFoundException e) {
            // Expired between GET and TTL
            LOG.debugf("Key %s expired before TTL query", key);
            return TTL_KEY_MISSING;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis TTL failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setWithExpiry(String key, String value, long ttlSeconds) {
        try {
            values.setex(key, ttlSeconds, value);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Redis SETEX failed for " + key + ": " + e.getMessage(), e);
        }
    }
}
