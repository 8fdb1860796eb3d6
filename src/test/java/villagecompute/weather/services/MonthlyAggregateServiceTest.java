/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.weather.api.types.CacheStatusType;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.api.types.MonthlyResponseType;
import villagecompute.weather.data.WarehouseRepository;
import villagecompute.weather.exceptions.WarehouseSchemaMissingException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;
import villagecompute.weather.testing.InMemorySnapshotStore;
import villagecompute.weather.testing.MutableClock;

/**
 * Unit tests for {@link MonthlyAggregateService}, wired against an in-memory snapshot store and a mocked warehouse.
 */
class MonthlyAggregateServiceTest {

    private static final List<MonthlyAggregateType> STOCKTON = List.of(
            new MonthlyAggregateType("Stockton", "2024-01-01", 10.0, 40.0, "2024-04-01 00:00:00"),
            new MonthlyAggregateType("Stockton", "2024-02-01", 12.5, 35.5, "2024-04-01 00:00:00"),
            new MonthlyAggregateType("Stockton", "2024-03-01", 15.0, 20.0, "2024-04-01 00:00:00"));

    @Mock
    WarehouseRepository warehouseRepository;

    @Mock
    Tracer tracer;

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private SimpleMeterRegistry meterRegistry;
    private CacheRefreshService cacheRefreshService;
    private MonthlyAggregateService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));

        clock = new MutableClock(Instant.parse("2025-01-09T10:00:00Z"));
        store = new InMemorySnapshotStore(clock);
        meterRegistry = new SimpleMeterRegistry();

        SnapshotCacheService snapshotCacheService = new SnapshotCacheService();
        snapshotCacheService.snapshotStore = store;
        snapshotCacheService.objectMapper = new ObjectMapper();
        snapshotCacheService.meterRegistry = meterRegistry;
        snapshotCacheService.teamName = "TeamA";

        FreshnessPolicy freshnessPolicy = new FreshnessPolicy();
        freshnessPolicy.configuredIntervalSeconds = 3600;

        cacheRefreshService = new CacheRefreshService();
        cacheRefreshService.warehouseRepository = warehouseRepository;
        cacheRefreshService.snapshotCacheService = snapshotCacheService;
        cacheRefreshService.clock = clock;
        cacheRefreshService.tracer = tracer;
        cacheRefreshService.meterRegistry = meterRegistry;
        cacheRefreshService.ttlSeconds = 3600;

        service = new MonthlyAggregateService();
        service.snapshotCacheService = snapshotCacheService;
        service.freshnessPolicy = freshnessPolicy;
        service.warehouseRepository = warehouseRepository;
        service.clock = clock;
        service.tracer = tracer;
        service.meterRegistry = meterRegistry;

        when(warehouseRepository.findAllMonthly()).thenReturn(STOCKTON);
        when(warehouseRepository.findMonthlyByCity("Stockton")).thenReturn(STOCKTON);
    }

    @Test
    void testGetMonthly_freshSnapshotIsFullFromCache() {
        cacheRefreshService.refresh("Stockton");

        MonthlyResponseType response = service.getMonthly("Stockton");

        assertEquals("cache", response.source());
        assertEquals("full", response.syncStatus());
        assertEquals("active", response.cacheStatus());
        assertEquals("hit", response.cacheLookup());
        assertEquals(3600L, response.ttlSeconds());
        assertEquals(3, response.count());
        assertEquals(10.0, response.data().get(0).avgTempC());
        assertEquals(15.0, response.data().get(2).avgTempC());
        assertEquals("2025-01-09T10:00:00Z", response.lastUpdated());
        assertNull(response.message());
        verify(warehouseRepository, never()).findMonthlyByCity(anyString());
    }

    @Test
    void testGetMonthly_agingSnapshotMovesThroughBands() {
        cacheRefreshService.refresh("Stockton");

        clock.advance(Duration.ofSeconds(2600));
        MonthlyResponseType partial = service.getMonthly("Stockton");
        assertEquals("partial", partial.syncStatus());
        assertEquals(1000L, partial.ttlSeconds());

        clock.advance(Duration.ofSeconds(500));
        MonthlyResponseType outOfSync = service.getMonthly("Stockton");
        assertEquals("cache", outOfSync.source());
        assertEquals("out-of-sync", outOfSync.syncStatus());
        assertEquals(500L, outOfSync.ttlSeconds());
        assertEquals(3, outOfSync.count());
    }

    @Test
    void testGetMonthly_expiredSnapshotFallsBackToWarehouse() {
        cacheRefreshService.refresh("Stockton");
        clock.advance(Duration.ofSeconds(3600));

        MonthlyResponseType response = service.getMonthly("Stockton");

        assertEquals("warehouse", response.source());
        assertEquals("missing", response.cacheLookup());
        assertEquals("none", response.cacheStatus());
        assertEquals("out-of-sync", response.syncStatus());
        assertNull(response.ttlSeconds());
        assertEquals(3, response.count());
    }

    @Test
    void testGetMonthly_unavailableCacheFallsBackToWarehouse() {
        store.setUnavailable(true);

        MonthlyResponseType response = service.getMonthly("Stockton");

        assertEquals("warehouse", response.source());
        assertEquals("unavailable", response.cacheLookup());
        assertEquals("out-of-sync", response.syncStatus());
        assertEquals("2024-01-01", response.data().get(0).month());
        assertEquals("2025-01-09T10:00:00Z", response.lastUpdated());
        verify(warehouseRepository).findMonthlyByCity("Stockton");
        assertEquals(1.0, meterRegistry.get("weather.monthly.requests").tag("source", "warehouse")
                .tag("sync_status", "out-of-sync").counter().count());
    }

    @Test
    void testGetMonthly_corruptSnapshotFallsBackToWarehouse() {
        store.putWithoutExpiry("weather:TeamA:stockton:monthly", "[broken");

        MonthlyResponseType response = service.getMonthly("Stockton");

        assertEquals("warehouse", response.source());
        assertEquals("corrupt", response.cacheLookup());
    }

    @Test
    void testGetMonthly_snapshotWithNullRowFallsBackToWarehouse() {
        store.putWithoutExpiry("weather:TeamA:stockton:monthly",
                "{\"data\":[null],\"metadata\":{\"refresh_interval_sec\":3600}}");

        MonthlyResponseType response = service.getMonthly("Stockton");

        assertEquals("warehouse", response.source());
        assertEquals("corrupt", response.cacheLookup());
        assertEquals("out-of-sync", response.syncStatus());
        assertEquals(3, response.count());
        verify(warehouseRepository).findMonthlyByCity("Stockton");
    }

    @Test
    void testGetMonthly_emptySnapshotServedFromCacheWithMessage() {
        cacheRefreshService.refresh("Nowhere");

        MonthlyResponseType response = service.getMonthly("Nowhere");

        assertEquals("cache", response.source());
        assertEquals(0, response.count());
        assertTrue(response.data().isEmpty());
        assertNotNull(response.message());
        verify(warehouseRepository, never()).findMonthlyByCity(anyString());
    }

    @Test
    void testGetMonthly_emptyWarehouseReturnsMessage() {
        when(warehouseRepository.findMonthlyByCity("Nowhere")).thenReturn(List.of());

        MonthlyResponseType response = service.getMonthly("Nowhere");

        assertEquals("warehouse", response.source());
        assertEquals(0, response.count());
        assertTrue(response.message().contains("Nowhere"));
    }

    @Test
    void testGetMonthly_warehouseFailurePropagates() {
        when(warehouseRepository.findMonthlyByCity("Stockton"))
                .thenThrow(new WarehouseUnavailableException("Connection refused", new RuntimeException()));

        assertThrows(WarehouseUnavailableException.class, () -> service.getMonthly("Stockton"));
        assertEquals(1.0, meterRegistry.get("weather.monthly.requests").tag("source", "error").counter().count());
    }

    @Test
    void testGetMonthly_missingSchemaPropagates() {
        when(warehouseRepository.findMonthlyByCity("Stockton"))
                .thenThrow(new WarehouseSchemaMissingException("Table weather_dw.monthly_agg does not exist",
                        new RuntimeException()));

        assertThrows(WarehouseSchemaMissingException.class, () -> service.getMonthly("Stockton"));
    }

    @Test
    void testGetCacheStatus_hit() {
        cacheRefreshService.refresh("Stockton");
        clock.advance(Duration.ofSeconds(125));

        CacheStatusType status = service.getCacheStatus("Stockton");

        assertTrue(status.cacheValid());
        assertEquals(3475L, status.ttlSeconds());
        assertEquals(57L, status.ttlMinutes());
        assertEquals("cache", status.source());
        assertEquals("hit", status.cacheLookup());
        assertEquals(3, status.dataCount());
        assertEquals("weather:TeamA:stockton:monthly", status.key());
        assertNotNull(status.metadata());
    }

    @Test
    void testGetCacheStatus_missing() {
        CacheStatusType status = service.getCacheStatus("Stockton");

        assertFalse(status.cacheValid());
        assertEquals("none", status.source());
        assertEquals("missing", status.cacheLookup());
        assertNotNull(status.message());
    }

    @Test
    void testGetCacheStatus_unavailable() {
        store.setUnavailable(true);

        CacheStatusType status = service.getCacheStatus("Stockton");

        assertFalse(status.cacheValid());
        assertEquals("error", status.source());
        assertTrue(status.message().startsWith("Redis connection failed"));
        verify(warehouseRepository, never()).findMonthlyByCity(anyString());
    }

    @Test
    void testGetCacheStatus_corrupt() {
        store.putWithoutExpiry("weather:TeamA:stockton:monthly", "{nope");

        CacheStatusType status = service.getCacheStatus("Stockton");

        assertEquals("error", status.source());
        assertEquals("corrupt", status.cacheLookup());
    }
}
