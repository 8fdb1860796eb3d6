/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.integration.weather;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.WeatherObservationType;
import villagecompute.weather.exceptions.WeatherApiException;
import villagecompute.weather.util.MeasurementValues;

/**
 * HTTP client for the Open-Meteo historical archive API.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Base URL: https://archive-api.open-meteo.com/v1/archive</li>
 * <li>No authentication required</li>
 * <li>Units: Celsius, m/s, mm (configured via query params)</li>
 * <li>Hourly arrays are index-aligned with {@code hourly.time}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * OpenMeteoArchiveClient client;
 *
 * ArchiveResponse response = client.fetchHourly(37.9575, -121.2925, start, end, "America/Los_Angeles");
 * }
 * </pre>
 *
 * @see <a href="https://open-meteo.com/en/docs/historical-weather-api">Open-Meteo Historical Weather API</a>
 */
@ApplicationScoped
public class OpenMeteoArchiveClient {

    private static final Logger LOG = Logger.getLogger(OpenMeteoArchiveClient.class);

    private static final String API_BASE = "https://archive-api.open-meteo.com/v1/archive";
    private static final String HOURLY_FIELDS = "temperature_2m,relative_humidity_2m,precipitation,wind_speed_10m,"
            + "wind_gusts_10m";
    private static final String USER_AGENT = "VillageComputeWeatherPipeline/1.0";
    private static final int TIMEOUT_SECONDS = 30;
    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Raw payload plus the observations parsed from it.
     *
     * @param payload
     *            full JSON response, stored verbatim as the raw document
     * @param observations
     *            hourly observations without location or batch metadata
     */
    public record ArchiveResponse(JsonNode payload, List<WeatherObservationType> observations) {
    }

    @Inject
    public OpenMeteoArchiveClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10)).build();
    }

    /**
     * Fetches hourly history for a coordinate and date window.
     *
     * @param latitude
     *            latitude coordinate (-90 to 90)
     * @param longitude
     *            longitude coordinate (-180 to 180)
     * @param startDate
     *            first day, inclusive
     * @param endDate
     *            last day, inclusive
     * @param timezone
     *            IANA zone the hourly timestamps are expressed in
     * @return payload and parsed observations
     * @throws WeatherApiException
     *             if the request fails, returns a non-200 status, or cannot be parsed
     */
    public ArchiveResponse fetchHourly(double latitude, double longitude, LocalDate startDate, LocalDate endDate,
            String timezone) {
        String url = buildApiUrl(latitude, longitude, startDate, endDate, timezone);
        LOG.debugf("Fetching Open-Meteo archive for %.4f,%.4f from %s to %s", latitude, longitude, startDate, endDate);

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url))
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS)).header("User-Agent", USER_AGENT).GET().build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WeatherApiException("Open-Meteo archive request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeatherApiException("Open-Meteo archive request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new WeatherApiException(
                    "Open-Meteo archive returned status " + response.statusCode() + ": " + truncate(response.body()));
        }

        return parseArchive(response.body());
    }

    String buildApiUrl(double latitude, double longitude, LocalDate startDate, LocalDate endDate, String timezone) {
        return String.format(Locale.ROOT,
                "%s?latitude=%s&longitude=%s&start_date=%s&end_date=%s&timezone=%s&hourly=%s"
                        + "&temperature_unit=celsius&windspeed_unit=ms&precipitation_unit=mm",
                API_BASE, latitude, longitude, startDate, endDate, URLEncoder.encode(timezone, StandardCharsets.UTF_8),
                URLEncoder.encode(HOURLY_FIELDS, StandardCharsets.UTF_8));
    }

    /**
     * Parses an archive response body into hourly observations.
     */
    ArchiveResponse parseArchive(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new WeatherApiException("Open-Meteo archive returned invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new WeatherApiException("Open-Meteo archive returned an empty payload");
        }
        return new ArchiveResponse(root, parseHourly(root.path("hourly")));
    }

    private List<WeatherObservationType> parseHourly(JsonNode hourly) {
        List<WeatherObservationType> observations = new ArrayList<>();
        JsonNode times = hourly.path("time");
        JsonNode temps = hourly.path("temperature_2m");
        JsonNode humidity = hourly.path("relative_humidity_2m");
        JsonNode precipitation = hourly.path("precipitation");
        JsonNode windSpeed = hourly.path("wind_speed_10m");
        JsonNode windGust = hourly.path("wind_gusts_10m");

        for (int i = 0; i < times.size(); i++) {
            Double temperatureC = number(temps.path(i), null);
            observations.add(new WeatherObservationType(times.get(i).asText(), temperatureC,
                    MeasurementValues.celsiusToFahrenheit(temperatureC), number(humidity.path(i), null),
                    number(precipitation.path(i), 0.0), number(windSpeed.path(i), null),
                    number(windGust.path(i), 0.0), null, null));
        }

        return observations;
    }

    private static Double number(JsonNode node, Double fallback) {
        if (!node.isNumber()) {
            return fallback;
        }
        double value = node.asDouble();
        return Double.isFinite(value) ? value : fallback;
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
    }
}
