/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * One row of {@code weather_dw.monthly_agg}: average temperature and total rainfall for a city and calendar month.
 *
 * <p>
 * The same shape is stored inside Redis snapshots and returned by {@code /api/monthly}, so cached and warehouse reads
 * are indistinguishable to the dashboard. Numeric fields are either a finite double or JSON {@code null}.
 *
 * @param city
 *            city name as stored in the warehouse (e.g., "Stockton")
 * @param month
 *            first day of the month, ISO-8601 date (e.g., "2024-01-01")
 * @param avgTempC
 *            average temperature in Celsius, null when no readings
 * @param totalRainMm
 *            summed precipitation in millimeters, null when no readings
 * @param warehouseLoadTime
 *            timestamp the aggregate was written to ClickHouse ("yyyy-MM-dd HH:mm:ss")
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record MonthlyAggregateType(@NotBlank String city, @NotBlank String month,
        @JsonProperty("avg_temp_c") Double avgTempC, @JsonProperty("total_rain_mm") Double totalRainMm,
        @JsonProperty("warehouse_load_time") String warehouseLoadTime) {
}
