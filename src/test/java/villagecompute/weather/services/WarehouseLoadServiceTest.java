/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.weather.api.types.FetchMetadataType;
import villagecompute.weather.api.types.ObservationLocationType;
import villagecompute.weather.api.types.WeatherObservationType;
import villagecompute.weather.data.DailyWeatherRow;
import villagecompute.weather.data.ObservationRepository;
import villagecompute.weather.data.WarehouseRepository;
import villagecompute.weather.exceptions.WarehouseUnavailableException;
import villagecompute.weather.testing.MutableClock;

/**
 * Unit tests for {@link WarehouseLoadService}.
 */
class WarehouseLoadServiceTest {

    private static final FetchMetadataType METADATA = new FetchMetadataType("2025-01-09T09:59:58.123Z",
            "open-meteo.com/archive", "as-provided", null, "etl-1736416798123", "weather-pipeline");
    private static final ObservationLocationType STOCKTON = new ObservationLocationType("Stockton", "CA");

    @Mock
    ObservationRepository observationRepository;

    @Mock
    WarehouseRepository warehouseRepository;

    @Mock
    Tracer tracer;

    private SimpleMeterRegistry meterRegistry;
    private WarehouseLoadService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        meterRegistry = new SimpleMeterRegistry();

        service = new WarehouseLoadService();
        service.observationRepository = observationRepository;
        service.warehouseRepository = warehouseRepository;
        service.clock = new MutableClock(Instant.parse("2025-01-09T10:00:00.750Z"));
        service.tracer = tracer;
        service.meterRegistry = meterRegistry;
        service.syncIntervalMin = 60;
    }

    @Test
    void testLoad_insertsRowsAndRebuildsAggregates() {
        when(observationRepository.findEnriched()).thenReturn(List.of(
                observation("2025-01-08T00:00", 8.5, STOCKTON),
                observation("2025-01-08T01:00", 8.1, STOCKTON)));
        when(warehouseRepository.insertDailyWeather(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        int inserted = service.load();

        assertEquals(2, inserted);
        verify(warehouseRepository).ensureSchema();
        verify(warehouseRepository).rebuildMonthlyAggregates(60);
        assertEquals(2.0, meterRegistry.get("weather.warehouse.load.rows").counter().count());
    }

    @Test
    void testLoad_noDocumentsSkipsInsert() {
        when(observationRepository.findEnriched()).thenReturn(List.of());

        assertEquals(0, service.load());

        verify(warehouseRepository).ensureSchema();
        verify(warehouseRepository, never()).insertDailyWeather(anyList());
        verify(warehouseRepository, never()).rebuildMonthlyAggregates(anyInt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLoad_rowsCarryLoadMetadata() {
        when(observationRepository.findEnriched())
                .thenReturn(List.of(observation("2025-01-08T13:00", 14.2, STOCKTON)));
        ArgumentCaptor<List<DailyWeatherRow>> captor = ArgumentCaptor.forClass(List.class);
        when(warehouseRepository.insertDailyWeather(captor.capture())).thenReturn(1);

        service.load();

        DailyWeatherRow row = captor.getValue().get(0);
        assertEquals(LocalDateTime.of(2025, 1, 8, 13, 0), row.observedAt());
        assertEquals(LocalDate.of(2025, 1, 8), row.date());
        assertEquals("Stockton", row.city());
        assertEquals("CA", row.state());
        assertEquals(14.2, row.temperatureC());
        assertEquals(LocalDateTime.of(2025, 1, 9, 10, 0, 0), row.warehouseLoadTime());
        assertEquals(LocalDateTime.of(2025, 1, 9, 9, 59, 58), row.sourceTimestamp());
        assertEquals("etl-1736416798123", row.etlBatchId());
        assertEquals(1, row.rowsLoaded());
        assertEquals(60, row.syncIntervalMin());
        assertEquals("incremental", row.loadMode());
    }

    @Test
    void testToRows_skipsRowsWithoutTimestampOrCity() {
        List<WeatherObservationType> observations = List.of(observation("2025-01-08T00:00", 8.5, STOCKTON),
                observation(null, 8.5, STOCKTON), observation("not-a-time", 8.5, STOCKTON),
                observation("2025-01-08T02:00", 8.5, null),
                observation("2025-01-08T03:00", 8.5, new ObservationLocationType(null, "CA")));

        List<DailyWeatherRow> rows = service.toRows(observations, LocalDateTime.of(2025, 1, 9, 10, 0));

        assertEquals(1, rows.size());
        assertEquals(LocalDateTime.of(2025, 1, 8, 0, 0), rows.get(0).observedAt());
    }

    @Test
    void testToRows_missingMetadataLeavesProvenanceNull() {
        WeatherObservationType bare = new WeatherObservationType("2025-01-08T00:00", null, null, null, 0.0, null, 0.0,
                STOCKTON, null);

        DailyWeatherRow row = service.toRows(List.of(bare), LocalDateTime.of(2025, 1, 9, 10, 0)).get(0);

        assertNull(row.sourceTimestamp());
        assertNull(row.author());
        assertNull(row.temperatureC());
    }

    @Test
    void testLoad_warehouseFailurePropagates() {
        doThrow(new WarehouseUnavailableException("Connection refused", new RuntimeException()))
                .when(warehouseRepository).ensureSchema();

        assertThrows(WarehouseUnavailableException.class, () -> service.load());
        assertEquals(1.0, meterRegistry.get("weather.warehouse.load.failures").counter().count());
    }

    private static WeatherObservationType observation(String timestamp, double temperatureC,
            ObservationLocationType location) {
        return new WeatherObservationType(timestamp, temperatureC, temperatureC * 9.0 / 5.0 + 32.0, 80.0, 0.2, 3.1,
                5.4, location, METADATA);
    }
}
