/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.weather.api.types.WeatherObservationType;
import villagecompute.weather.data.ObservationRepository;
import villagecompute.weather.data.RawFetchDocument;
import villagecompute.weather.exceptions.WeatherApiException;
import villagecompute.weather.integration.weather.OpenMeteoArchiveClient;
import villagecompute.weather.testing.MutableClock;

/**
 * Unit tests for {@link WeatherIngestService}.
 */
class WeatherIngestServiceTest {

    @Mock
    OpenMeteoArchiveClient archiveClient;

    @Mock
    ObservationRepository observationRepository;

    @Mock
    Tracer tracer;

    private SimpleMeterRegistry meterRegistry;
    private WeatherIngestService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        meterRegistry = new SimpleMeterRegistry();

        service = new WeatherIngestService();
        service.archiveClient = archiveClient;
        service.observationRepository = observationRepository;
        service.clock = new MutableClock(Instant.parse("2025-01-09T10:00:00Z"));
        service.tracer = tracer;
        service.meterRegistry = meterRegistry;
        service.city = "Stockton";
        service.state = "CA";
        service.latitude = 37.9575;
        service.longitude = -121.2925;
        service.timezone = "America/Los_Angeles";
        service.hoursBack = 24;
        service.author = "weather-pipeline";
    }

    @Test
    @SuppressWarnings("unchecked")
    void testIngest_enrichesAndStoresObservations() {
        List<WeatherObservationType> fetched = List.of(
                new WeatherObservationType("2025-01-08T00:00", 8.5, 47.3, 80.0, 0.0, 3.1, 5.4, null, null),
                new WeatherObservationType("2025-01-08T01:00", 8.1, 46.58, 82.0, 0.4, 2.9, 4.8, null, null));
        when(archiveClient.fetchHourly(37.9575, -121.2925, LocalDate.of(2025, 1, 8), LocalDate.of(2025, 1, 9),
                "America/Los_Angeles"))
                .thenReturn(new OpenMeteoArchiveClient.ArchiveResponse(JsonNodeFactory.instance.objectNode(), fetched));
        ArgumentCaptor<RawFetchDocument> rawCaptor = ArgumentCaptor.forClass(RawFetchDocument.class);
        ArgumentCaptor<List<WeatherObservationType>> enrichedCaptor = ArgumentCaptor.forClass(List.class);
        when(observationRepository.saveBatch(rawCaptor.capture(), enrichedCaptor.capture())).thenReturn(2);

        int stored = service.ingest();

        assertEquals(2, stored);
        WeatherObservationType first = enrichedCaptor.getValue().get(0);
        assertEquals("Stockton", first.location().city());
        assertEquals("CA", first.location().state());
        assertEquals("open-meteo.com/archive", first.metadata().sourceDatabase());
        assertEquals("etl-1736416800000", first.metadata().etlBatchId());
        assertEquals("weather-pipeline", first.metadata().author());
        assertEquals("2025-01-09T10:00:00Z", first.metadata().sourceTimestamp());

        RawFetchDocument raw = rawCaptor.getValue();
        assertEquals("2025-01-08", raw.start());
        assertEquals("2025-01-09", raw.end());
        assertEquals("Stockton", raw.city());
        assertEquals(2.0, meterRegistry.get("weather.ingest.observations").counter().count());
    }

    @Test
    void testIngest_apiFailurePropagatesWithoutWriting() {
        when(archiveClient.fetchHourly(anyDouble(), anyDouble(), any(), any(), eq("America/Los_Angeles")))
                .thenThrow(new WeatherApiException("Open-Meteo archive returned 500"));

        WeatherApiException e = assertThrows(WeatherApiException.class, () -> service.ingest());

        assertTrue(e.getMessage().contains("500"));
        verify(observationRepository, never()).saveBatch(any(), anyList());
        assertEquals(1.0, meterRegistry.get("weather.ingest.failures").counter().count());
    }
}
