/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row of {@code weather_dw.daily_weather}: an hourly observation plus source and warehouse provenance.
 */
public record DailyWeatherRow(LocalDateTime observedAt, LocalDate date, Double temperatureC, Double temperatureF,
        Double humidityPercent, Double rainfallMm, Double windSpeedMps, Double windGustMps, String city, String state,
        LocalDateTime sourceTimestamp, String sourceDatabase, String dataQuality, String apiRequestId,
        String etlBatchId, String author, LocalDateTime warehouseLoadTime, int rowsLoaded, int syncIntervalMin,
        String loadMode) {
}
