/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

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
import villagecompute.weather.api.types.FetchMetadataType;
import villagecompute.weather.api.types.ObservationLocationType;
import villagecompute.weather.api.types.WeatherObservationType;
import villagecompute.weather.data.ObservationRepository;
import villagecompute.weather.data.RawFetchDocument;
import villagecompute.weather.integration.weather.OpenMeteoArchiveClient;

/**
 * Fetches recent hourly history for the configured location and stores it in MongoDB.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code weather.location.city}, {@code weather.location.state} - Location tag on every observation</li>
 * <li>{@code weather.location.latitude}, {@code weather.location.longitude} - Archive coordinates</li>
 * <li>{@code weather.location.timezone} - Zone of the hourly timestamps</li>
 * <li>{@code weather.ingest.hours-back} - Window size ending now (default: 24)</li>
 * <li>{@code weather.ingest.author} - Author recorded in batch metadata</li>
 * </ul>
 */
@ApplicationScoped
public class WeatherIngestService {

    private static final Logger LOG = Logger.getLogger(WeatherIngestService.class);

    static final String SOURCE_DATABASE = "open-meteo.com/archive";
    static final String DATA_QUALITY = "as-provided";

    @Inject
    OpenMeteoArchiveClient archiveClient;

    @Inject
    ObservationRepository observationRepository;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather.location.city",
            defaultValue = "Stockton")
    String city;

    @ConfigProperty(
            name = "weather.location.state",
            defaultValue = "CA")
    String state;

    @ConfigProperty(
            name = "weather.location.latitude",
            defaultValue = "37.9575")
    double latitude;

    @ConfigProperty(
            name = "weather.location.longitude",
            defaultValue = "-121.2925")
    double longitude;

    @ConfigProperty(
            name = "weather.location.timezone",
            defaultValue = "America/Los_Angeles")
    String timezone;

    @ConfigProperty(
            name = "weather.ingest.hours-back",
            defaultValue = "24")
    int hoursBack;

    @ConfigProperty(
            name = "weather.ingest.author",
            defaultValue = "weather-pipeline")
    String author;

    /**
     * Fetches the configured window and stores one raw document plus one enriched document per hour.
     *
     * @return number of enriched observations stored
     * @throws villagecompute.weather.exceptions.WeatherApiException
     *             if the archive API fails
     */
    public int ingest() {
        Span span = tracer.spanBuilder("weather.ingest").setAttribute("city", city).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            Instant now = clock.instant();
            LocalDate endDate = LocalDate.ofInstant(now, ZoneOffset.UTC);
            LocalDate startDate = LocalDate.ofInstant(now.minus(Duration.ofHours(Math.max(hoursBack, 1))),
                    ZoneOffset.UTC);

            OpenMeteoArchiveClient.ArchiveResponse response = archiveClient.fetchHourly(latitude, longitude,
                    startDate, endDate, timezone);

            FetchMetadataType metadata = new FetchMetadataType(now.toString(), SOURCE_DATABASE, DATA_QUALITY, null,
                    "etl-" + now.toEpochMilli(), author);
            ObservationLocationType location = new ObservationLocationType(city, state);
            List<WeatherObservationType> enriched = response.observations().stream()
                    .map(observation -> observation.enrich(location, metadata)).toList();

            RawFetchDocument raw = new RawFetchDocument(latitude, longitude, startDate.toString(),
                    endDate.toString(), now.toString(), city, state, metadata, response.payload());
            int stored = observationRepository.saveBatch(raw, enriched);

            span.setAttribute("observations", stored);
            Counter.builder("weather.ingest.observations").tag("city", city).register(meterRegistry)
                    .increment(stored);
            LOG.infof("Ingested %d hourly observations for %s, %s (%s to %s, batch %s)", stored, city, state,
                    startDate, endDate, metadata.etlBatchId());
            return stored;

        } catch (RuntimeException e) {
            span.recordException(e);
            Counter.builder("weather.ingest.failures").tag("city", city).register(meterRegistry).increment();
            LOG.errorf(e, "Weather ingest failed for %s", city);
            throw e;
        } finally {
            sample.stop(Timer.builder("weather.ingest.duration").register(meterRegistry));
            span.end();
        }
    }
}
