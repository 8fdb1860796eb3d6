/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.CacheMetadataType;
import villagecompute.weather.api.types.CacheSnapshotType;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.data.WarehouseRepository;

/**
 * Materializes the Redis snapshot of one city's monthly aggregates from the warehouse.
 *
 * <h2>Refresh Steps</h2>
 * <ol>
 * <li>Read every monthly aggregate from {@code weather_dw.monthly_agg}</li>
 * <li>Keep rows whose city matches, ignoring case</li>
 * <li>Write {@code {team, city, metric, data, metadata}} with SETEX using {@code weather.cache.ttl-seconds}</li>
 * </ol>
 *
 * <p>
 * A city with no rows still gets a snapshot with empty {@code data}; "no data" is cached like any other result.
 * {@code cache_timestamp} strictly increases across refreshes in this process and {@code data_version} is derived from
 * it.
 */
@ApplicationScoped
public class CacheRefreshService {

    private static final Logger LOG = Logger.getLogger(CacheRefreshService.class);

    @Inject
    WarehouseRepository warehouseRepository;

    @Inject
    SnapshotCacheService snapshotCacheService;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather.cache.ttl-seconds",
            defaultValue = "3600")
    long ttlSeconds;

    private Instant lastWrite = Instant.EPOCH;

    /**
     * Rebuilds and overwrites the snapshot for a city.
     *
     * @param city
     *            city name as requested
     * @return snapshot written
     * @throws villagecompute.weather.exceptions.WarehouseException
     *             if the warehouse read fails
     * @throws villagecompute.weather.exceptions.CacheUnavailableException
     *             if the snapshot cannot be written
     */
    public CacheSnapshotType refresh(String city) {
        Span span = tracer.spanBuilder("cache.refresh").setAttribute("city", city).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            List<MonthlyAggregateType> all = warehouseRepository.findAllMonthly();
            String wanted = city.toLowerCase(Locale.ROOT);
            List<MonthlyAggregateType> rows = all.stream()
                    .filter(row -> row.city() != null && row.city().toLowerCase(Locale.ROOT).equals(wanted)).toList();

            if (rows.isEmpty()) {
                LOG.warnf("No monthly aggregates for %s; caching empty snapshot", city);
            }

            long ttl = FreshnessPolicy.effectiveInterval(ttlSeconds);
            Instant timestamp = nextTimestamp();
            CacheMetadataType metadata = new CacheMetadataType(timestamp.toString(), "v" + timestamp.toEpochMilli(),
                    ttl);
            CacheSnapshotType snapshot = new CacheSnapshotType(snapshotCacheService.teamName(), city,
                    SnapshotCacheService.METRIC, rows, metadata);

            String key = snapshotCacheService.write(snapshot, ttl);
            span.setAttribute("rows", rows.size());
            span.setAttribute("data_version", metadata.dataVersion());
            incrementCounter("success");
            LOG.infof("Cached %d monthly rows for %s under %s (version=%s, ttl=%ds)", rows.size(), city, key,
                    metadata.dataVersion(), ttl);
            return snapshot;

        } catch (RuntimeException e) {
            span.recordException(e);
            incrementCounter("failure");
            LOG.errorf(e, "Failed to refresh snapshot for %s", city);
            throw e;
        } finally {
            sample.stop(Timer.builder("weather.cache.refresh.duration").register(meterRegistry));
            span.end();
        }
    }

    private synchronized Instant nextTimestamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (!now.isAfter(lastWrite)) {
            now = lastWrite.plusMillis(1);
        }
        lastWrite = now;
        return now;
    }

    private void incrementCounter(String status) {
        Counter.builder("weather.cache.refresh.total").tag("status", status).register(meterRegistry).increment();
    }
}
