/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.config;

import java.time.Clock;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.weather.services.FreshnessPolicy;

/**
 * Startup validation and shared producers for the weather pipeline.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather.team-name} - Deployment tag embedded in Redis keys (default: UnknownTeam, env
 * WEATHER_TEAM_NAME)</li>
 * <li>{@code weather.cache.ttl-seconds} - Snapshot TTL and declared refresh interval (default: 3600, env
 * WEATHER_CACHE_TTL_SECONDS)</li>
 * <li>{@code weather.cache.cities} - Cities refreshed by the scheduled cache job (default: Stockton)</li>
 * <li>{@code quarkus.datasource.jdbc.url} - ClickHouse JDBC URL</li>
 * <li>{@code quarkus.redis.hosts} - Redis URL</li>
 * <li>{@code quarkus.mongodb.connection-string} - MongoDB URL</li>
 * </ul>
 *
 * <p>
 * A non-positive TTL is not fatal: it is reported here once and every consumer substitutes
 * {@link FreshnessPolicy#DEFAULT_REFRESH_INTERVAL_SECONDS}.
 */
@ApplicationScoped
@Startup
public class PipelineConfig {

    private static final Logger LOG = Logger.getLogger(PipelineConfig.class);

    @ConfigProperty(
            name = "weather.team-name",
            defaultValue = "UnknownTeam")
    String teamName;

    @ConfigProperty(
            name = "weather.cache.ttl-seconds",
            defaultValue = "3600")
    long cacheTtlSeconds;

    @ConfigProperty(
            name = "quarkus.datasource.jdbc.url",
            defaultValue = "jdbc:clickhouse://localhost:8123/default")
    String warehouseUrl;

    @PostConstruct
    void validateConfiguration() {
        if (cacheTtlSeconds <= 0) {
            LOG.warnf("weather.cache.ttl-seconds=%d is not positive; using default of %d seconds", cacheTtlSeconds,
                    FreshnessPolicy.DEFAULT_REFRESH_INTERVAL_SECONDS);
        }
        if ("UnknownTeam".equals(teamName)) {
            LOG.warn("weather.team-name is not set; Redis keys will use the UnknownTeam tag");
        }
        LOG.infof("Weather pipeline configured: team=%s, cacheTtl=%ds, warehouse=%s", teamName,
                FreshnessPolicy.effectiveInterval(cacheTtlSeconds), warehouseUrl);
    }

    /**
     * Produces the UTC clock used for snapshot timestamps and ingest windows.
     *
     * @return system UTC clock
     */
    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
