/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One hourly observation from the Open-Meteo archive, as stored in the enriched MongoDB collection.
 *
 * <p>
 * Field names are camelCase in the document store; the warehouse load maps them onto {@code daily_weather} columns.
 *
 * @param timestamp
 *            local observation hour from the API (e.g., "2024-01-01T13:00")
 * @param temperatureC
 *            air temperature at 2m in Celsius, null when the API had no reading
 * @param temperatureF
 *            temperatureC converted to Fahrenheit, null when temperatureC is null
 * @param humidityPercent
 *            relative humidity at 2m
 * @param rainfallMm
 *            precipitation in millimeters (0 when missing)
 * @param windSpeedMps
 *            wind speed at 10m in m/s
 * @param windGustMps
 *            wind gusts at 10m in m/s (0 when missing)
 * @param location
 *            city/state, set during enrichment
 * @param metadata
 *            batch provenance, set during enrichment
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record WeatherObservationType(String timestamp, Double temperatureC, Double temperatureF,
        Double humidityPercent, Double rainfallMm, Double windSpeedMps, Double windGustMps,
        ObservationLocationType location, FetchMetadataType metadata) {

    /**
     * Returns a copy enriched with location and batch metadata.
     *
     * @param location
     *            observation location
     * @param metadata
     *            batch provenance
     * @return enriched observation
     */
    public WeatherObservationType enrich(ObservationLocationType location, FetchMetadataType metadata) {
        return new WeatherObservationType(timestamp, temperatureC, temperatureF, humidityPercent, rainfallMm,
                windSpeedMps, windGustMps, location, metadata);
    }
}
