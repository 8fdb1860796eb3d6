/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.util.List;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.CacheMetadataType;
import villagecompute.weather.api.types.CacheSnapshotType;
import villagecompute.weather.api.types.CacheStatusType;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.api.types.MonthlyResponseType;
import villagecompute.weather.data.WarehouseRepository;
import villagecompute.weather.util.MeasurementValues;

/**
 * Serves monthly aggregates from the Redis snapshot when one is readable, otherwise from ClickHouse.
 *
 * <h2>Read Path</h2>
 * <ol>
 * <li>Look up the snapshot (never throws)</li>
 * <li>Ask {@link FreshnessPolicy#selectSource(CacheLookup)} for the source and sync status</li>
 * <li>Cache: return snapshot data with the live TTL</li>
 * <li>Warehouse: query {@code monthly_agg} for the city ordered by month, always {@code out-of-sync}</li>
 * </ol>
 *
 * <p>
 * Warehouse failures propagate as {@link villagecompute.weather.exceptions.WarehouseException} subtypes for the
 * resource layer to map. Zero rows is a successful response carrying an explanatory message.
 */
@ApplicationScoped
public class MonthlyAggregateService {

    private static final Logger LOG = Logger.getLogger(MonthlyAggregateService.class);

    static final String CACHE_ACTIVE = "active";
    static final String CACHE_NONE = "none";

    @Inject
    SnapshotCacheService snapshotCacheService;

    @Inject
    FreshnessPolicy freshnessPolicy;

    @Inject
    WarehouseRepository warehouseRepository;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Returns monthly aggregates for a city.
     *
     * @param city
     *            city name
     * @return response tagged with source, sync status and TTL
     * @throws villagecompute.weather.exceptions.WarehouseException
     *             if the warehouse fallback fails
     */
    public MonthlyResponseType getMonthly(String city) {
        Span span = tracer.spanBuilder("monthly.get").setAttribute("city", city).startSpan();

        try (Scope scope = span.makeCurrent()) {
            CacheLookup lookup = snapshotCacheService.lookup(city);
            FreshnessPolicy.SourceDecision decision = freshnessPolicy.selectSource(lookup);
            span.setAttribute("cache_lookup", lookup.status().wireValue());
            span.setAttribute("source", decision.source().wireValue());
            span.setAttribute("sync_status", decision.syncStatus().wireValue());

            MonthlyResponseType response = decision.source() == ReadSource.CACHE
                    ? fromCache(city, lookup, decision)
                    : fromWarehouse(city, lookup);

            Counter.builder("weather.monthly.requests").tag("source", response.source())
                    .tag("sync_status", response.syncStatus()).register(meterRegistry).increment();
            return response;

        } catch (RuntimeException e) {
            span.recordException(e);
            Counter.builder("weather.monthly.requests").tag("source", "error").tag("sync_status", "none")
                    .register(meterRegistry).increment();
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Reports the state of a city's snapshot without touching the warehouse.
     *
     * @param city
     *            city name
     * @return cache status
     */
    public CacheStatusType getCacheStatus(String city) {
        CacheLookup lookup = snapshotCacheService.lookup(city);
        String status = lookup.status().wireValue();

        return switch (lookup.status()) {
            case HIT -> {
                CacheSnapshotType snapshot = lookup.snapshot();
                long ttl = lookup.ttlSeconds();
                yield new CacheStatusType(true, ttl, Math.floorDiv(ttl, 60L), lookup.key(),
                        ReadSource.CACHE.wireValue(), status, snapshot.metadata(), snapshot.data().size(), null);
            }
            case MISSING -> new CacheStatusType(false, 0, 0, lookup.key(), CACHE_NONE, status, null, null,
                    "Snapshot not found. Run POST /api/sync-now or wait for the next cache refresh.");
            case UNAVAILABLE -> new CacheStatusType(false, 0, 0, lookup.key(), "error", status, null, null,
                    "Redis connection failed: " + lookup.detail());
            case CORRUPT -> new CacheStatusType(false, 0, 0, lookup.key(), "error", status, null, null,
                    "Cached snapshot is unreadable: " + lookup.detail() + ". Run POST /api/sync-now to rewrite it.");
        };
    }

    private MonthlyResponseType fromCache(String city, CacheLookup lookup, FreshnessPolicy.SourceDecision decision) {
        CacheSnapshotType snapshot = lookup.snapshot();
        List<MonthlyAggregateType> data = snapshot.data().stream().map(MonthlyAggregateService::normalize).toList();
        CacheMetadataType metadata = snapshot.metadata();
        String lastUpdated = metadata != null && metadata.cacheTimestamp() != null
                ? metadata.cacheTimestamp()
                : clock.instant().toString();

        String message = data.isEmpty()
                ? "No monthly data cached for " + city + ". Run the warehouse load, then refresh the cache."
                : null;
        LOG.debugf("Serving %d rows for %s from cache (sync=%s, ttl=%ds)", data.size(), city,
                decision.syncStatus().wireValue(), decision.ttlSeconds());

        return new MonthlyResponseType(data, ReadSource.CACHE.wireValue(), lastUpdated, CACHE_ACTIVE,
                decision.syncStatus().wireValue(), decision.ttlSeconds(), data.size(), lookup.status().wireValue(),
                message);
    }

    private MonthlyResponseType fromWarehouse(String city, CacheLookup lookup) {
        List<MonthlyAggregateType> data = warehouseRepository.findMonthlyByCity(city).stream()
                .map(MonthlyAggregateService::normalize).toList();

        String message = data.isEmpty()
                ? "No monthly data found for " + city + ". Run the weather fetch and warehouse load jobs first."
                : null;
        LOG.debugf("Serving %d rows for %s from warehouse (cache lookup %s)", data.size(), city,
                lookup.status().wireValue());

        return new MonthlyResponseType(data, ReadSource.WAREHOUSE.wireValue(), clock.instant().toString(), CACHE_NONE,
                SyncStatus.OUT_OF_SYNC.wireValue(), null, data.size(), lookup.status().wireValue(), message);
    }

    private static MonthlyAggregateType normalize(MonthlyAggregateType row) {
        return new MonthlyAggregateType(row.city(), row.month(), MeasurementValues.toDoubleOrNull(row.avgTempC()),
                MeasurementValues.toDoubleOrNull(row.totalRainMm()), row.warehouseLoadTime());
    }
}
