/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

/**
 * City and state an hourly observation was recorded for.
 *
 * @param city
 *            city name (e.g., "Stockton")
 * @param state
 *            two-letter state code (e.g., "CA")
 */
public record ObservationLocationType(String city, String state) {
}
