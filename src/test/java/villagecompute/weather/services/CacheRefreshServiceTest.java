/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.weather.api.types.CacheSnapshotType;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.data.WarehouseRepository;
import villagecompute.weather.exceptions.CacheUnavailableException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;
import villagecompute.weather.testing.InMemorySnapshotStore;
import villagecompute.weather.testing.MutableClock;

/**
 * Unit tests for {@link CacheRefreshService}.
 */
class CacheRefreshServiceTest {

    private static final String STOCKTON_KEY = "weather:TeamA:stockton:monthly";

    @Mock
    WarehouseRepository warehouseRepository;

    @Mock
    Tracer tracer;

    private MutableClock clock;
    private InMemorySnapshotStore store;
    private MeterRegistry meterRegistry;
    private SnapshotCacheService snapshotCacheService;
    private CacheRefreshService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));

        clock = new MutableClock(Instant.parse("2025-01-09T10:00:00Z"));
        store = new InMemorySnapshotStore(clock);
        meterRegistry = new SimpleMeterRegistry();

        snapshotCacheService = new SnapshotCacheService();
        snapshotCacheService.snapshotStore = store;
        snapshotCacheService.objectMapper = new ObjectMapper();
        snapshotCacheService.meterRegistry = meterRegistry;
        snapshotCacheService.teamName = "TeamA";

        service = new CacheRefreshService();
        service.warehouseRepository = warehouseRepository;
        service.snapshotCacheService = snapshotCacheService;
        service.clock = clock;
        service.tracer = tracer;
        service.meterRegistry = meterRegistry;
        service.ttlSeconds = 3600;

        when(warehouseRepository.findAllMonthly()).thenReturn(List.of(
                new MonthlyAggregateType("Modesto", "2024-01-01", 9.0, 30.0, "2024-04-01 00:00:00"),
                new MonthlyAggregateType("Stockton", "2024-01-01", 10.0, 40.0, "2024-04-01 00:00:00"),
                new MonthlyAggregateType("Stockton", "2024-02-01", 12.5, 35.5, "2024-04-01 00:00:00"),
                new MonthlyAggregateType("Stockton", "2024-03-01", 15.0, 20.0, "2024-04-01 00:00:00")));
    }

    @Test
    void testRefresh_filtersToCityAndWritesWithTtl() {
        CacheSnapshotType snapshot = service.refresh("Stockton");

        assertEquals(3, snapshot.data().size());
        assertTrue(snapshot.data().stream().allMatch(row -> row.city().equals("Stockton")));
        assertEquals("TeamA", snapshot.team());
        assertEquals("monthly_agg", snapshot.metric());
        assertEquals(3600L, snapshot.metadata().refreshIntervalSec());
        assertEquals("2025-01-09T10:00:00Z", snapshot.metadata().cacheTimestamp());
        assertEquals(3600, store.ttlSeconds(STOCKTON_KEY));
        assertEquals(1.0, meterRegistry.get("weather.cache.refresh.total").tag("status", "success").counter().count());
    }

    @Test
    void testRefresh_cityMatchIgnoresCase() {
        CacheSnapshotType snapshot = service.refresh("stockton");

        assertEquals(3, snapshot.data().size());
        assertEquals("stockton", snapshot.city());
        assertTrue(store.contains(STOCKTON_KEY));
    }

    @Test
    void testRefresh_twiceKeepsDataAndAdvancesTimestamp() {
        CacheSnapshotType first = service.refresh("Stockton");
        CacheSnapshotType second = service.refresh("Stockton");

        assertEquals(first.data(), second.data());
        assertTrue(Instant.parse(second.metadata().cacheTimestamp())
                .isAfter(Instant.parse(first.metadata().cacheTimestamp())));
        assertNotEquals(first.metadata().dataVersion(), second.metadata().dataVersion());
    }

    @Test
    void testRefresh_resetsTtl() {
        service.refresh("Stockton");
        clock.advance(Duration.ofSeconds(1000));
        assertEquals(2600, store.ttlSeconds(STOCKTON_KEY));

        service.refresh("Stockton");

        assertEquals(3600, store.ttlSeconds(STOCKTON_KEY));
    }

    @Test
    void testRefresh_emptyCityStillWritesSnapshot() {
        CacheSnapshotType snapshot = service.refresh("Nowhere");

        assertTrue(snapshot.data().isEmpty());
        assertTrue(store.contains("weather:TeamA:nowhere:monthly"));
        assertEquals(CacheLookup.Status.HIT, snapshotCacheService.lookup("Nowhere").status());
    }

    @Test
    void testRefresh_invalidTtlUsesDefault() {
        service.ttlSeconds = 0;

        CacheSnapshotType snapshot = service.refresh("Stockton");

        assertEquals(3600L, snapshot.metadata().refreshIntervalSec());
        assertEquals(3600, store.ttlSeconds(STOCKTON_KEY));
    }

    @Test
    void testRefresh_warehouseFailurePropagatesAndLeavesCacheUntouched() {
        when(warehouseRepository.findAllMonthly())
                .thenThrow(new WarehouseUnavailableException("Connection refused", new RuntimeException()));

        assertThrows(WarehouseUnavailableException.class, () -> service.refresh("Stockton"));
        assertFalse(store.contains(STOCKTON_KEY));
        assertEquals(1.0, meterRegistry.get("weather.cache.refresh.total").tag("status", "failure").counter().count());
    }

    @Test
    void testRefresh_redisFailurePropagates() {
        store.setUnavailable(true);

        assertThrows(CacheUnavailableException.class, () -> service.refresh("Stockton"));
    }
}
