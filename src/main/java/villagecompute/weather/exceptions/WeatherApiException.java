/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when the Open-Meteo archive API returns an error or an unparseable payload.
 *
 * <p>
 * Extends RuntimeException per project standards. Fails the ingest job; nothing is written to MongoDB for that run.
 */
public class WeatherApiException extends RuntimeException {

    public WeatherApiException(String message) {
        super(message);
    }

    public WeatherApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
