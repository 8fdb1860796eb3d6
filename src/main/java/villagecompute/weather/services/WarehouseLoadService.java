/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
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
import villagecompute.weather.data.DailyWeatherRow;
import villagecompute.weather.data.ObservationRepository;
import villagecompute.weather.data.WarehouseRepository;

/**
 * Loads enriched observations from MongoDB into ClickHouse and rebuilds the monthly aggregates.
 *
 * <h2>Load Steps</h2>
 * <ol>
 * <li>Ensure {@code weather_dw} and its tables exist</li>
 * <li>Read every enriched observation; stop when there are none</li>
 * <li>Batch-insert them into {@code daily_weather} with warehouse load metadata</li>
 * <li>Re-aggregate {@code monthly_agg} by (city, month)</li>
 * </ol>
 *
 * <p>
 * Both tables replace rows on their sort key, so re-running a load over the same documents does not duplicate
 * observations or monthly aggregates.
 */
@ApplicationScoped
public class WarehouseLoadService {

    private static final Logger LOG = Logger.getLogger(WarehouseLoadService.class);

    static final String LOAD_MODE = "incremental";

    @Inject
    ObservationRepository observationRepository;

    @Inject
    WarehouseRepository warehouseRepository;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "weather.warehouse.sync-interval-min",
            defaultValue = "60")
    int syncIntervalMin;

    /**
     * Runs one incremental load.
     *
     * @return number of daily rows inserted, 0 when MongoDB had nothing to load
     * @throws villagecompute.weather.exceptions.WarehouseException
     *             if ClickHouse rejects the schema, insert or aggregation
     */
    public int load() {
        Span span = tracer.spanBuilder("warehouse.load").startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            warehouseRepository.ensureSchema();

            List<WeatherObservationType> observations = observationRepository.findEnriched();
            LOG.infof("Loaded %d enriched observations from MongoDB", observations.size());
            if (observations.isEmpty()) {
                LOG.info("No documents found, skipping warehouse load");
                span.setAttribute("rows", 0);
                return 0;
            }

            LocalDateTime loadTime = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC)
                    .truncatedTo(ChronoUnit.SECONDS);
            List<DailyWeatherRow> rows = toRows(observations, loadTime);

            int inserted = warehouseRepository.insertDailyWeather(rows);
            warehouseRepository.rebuildMonthlyAggregates(syncIntervalMin);

            span.setAttribute("rows", inserted);
            Counter.builder("weather.warehouse.load.rows").register(meterRegistry).increment(inserted);
            LOG.infof("Warehouse load complete: %d rows into daily_weather, monthly_agg rebuilt", inserted);
            return inserted;

        } catch (RuntimeException e) {
            span.recordException(e);
            Counter.builder("weather.warehouse.load.failures").register(meterRegistry).increment();
            LOG.errorf(e, "Warehouse load failed");
            throw e;
        } finally {
            sample.stop(Timer.builder("weather.warehouse.load.duration").register(meterRegistry));
            span.end();
        }
    }

    List<DailyWeatherRow> toRows(List<WeatherObservationType> observations, LocalDateTime loadTime) {
        List<DailyWeatherRow> rows = new ArrayList<>(observations.size());
        int skipped = 0;

        for (WeatherObservationType observation : observations) {
            LocalDateTime observedAt = parseLocalTimestamp(observation.timestamp());
            ObservationLocationType location = observation.location();
            if (observedAt == null || location == null || location.city() == null) {
                skipped++;
                continue;
            }

            FetchMetadataType metadata = observation.metadata();
            rows.add(new DailyWeatherRow(observedAt, observedAt.toLocalDate(), observation.temperatureC(),
                    observation.temperatureF(), observation.humidityPercent(), observation.rainfallMm(),
                    observation.windSpeedMps(), observation.windGustMps(), location.city(), location.state(),
                    metadata != null ? parseInstant(metadata.sourceTimestamp()) : null,
                    metadata != null ? metadata.sourceDatabase() : null,
                    metadata != null ? metadata.dataQuality() : null,
                    metadata != null ? metadata.apiRequestId() : null,
                    metadata != null ? metadata.etlBatchId() : null, metadata != null ? metadata.author() : null,
                    loadTime, 1, syncIntervalMin, LOAD_MODE));
        }

        if (skipped > 0) {
            LOG.warnf("Skipped %d observations without a parseable timestamp or city", skipped);
        }
        return rows;
    }

    private static LocalDateTime parseLocalTimestamp(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(timestamp);
        } catch (DateTimeParseException e) {
            LOG.debugf("Unparseable observation timestamp %s", timestamp);
            return null;
        }
    }

    private static LocalDateTime parseInstant(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return LocalDateTime.ofInstant(Instant.parse(timestamp), ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            LOG.debugf("Unparseable source timestamp %s", timestamp);
            return null;
        }
    }
}
