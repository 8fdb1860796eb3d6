/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.observability.LoggingConfig;
import villagecompute.weather.services.CacheRefreshService;

/**
 * Job handler that rewrites Redis snapshots from the warehouse.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ul>
 * <li>Empty payload: refresh every city in {@code weather.cache.cities} (scheduled job)</li>
 * <li>Payload with {@code city}: refresh that city only</li>
 * </ul>
 *
 * <p>
 * <b>Error Handling:</b> Individual city failures do NOT abort the batch. The job fails only when every city failed,
 * which usually means ClickHouse or Redis is down.
 *
 * <p>
 * <b>Telemetry:</b> Exports OpenTelemetry span attributes {@code cities_total}, {@code cities_success} and
 * {@code cities_failed}. Per-city counters and timers are recorded by {@link CacheRefreshService}.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "city": "Stockton"  // Optional - refresh one city
 * }
 * </pre>
 */
@ApplicationScoped
public class CacheRefreshJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CacheRefreshJobHandler.class);

    public static final String PAYLOAD_CITY = "city";

    @Inject
    CacheRefreshService cacheRefreshService;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "weather.cache.cities",
            defaultValue = "Stockton")
    List<String> configuredCities;

    @Override
    public JobType handlesType() {
        return JobType.CACHE_REFRESH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        Set<String> cities = targetCities(payload);

        Span span = tracer.spanBuilder("job.cache_refresh").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.CACHE_REFRESH.name()).setAttribute("cities_total", cities.size())
                .startSpan();

        int successCount = 0;
        int failureCount = 0;
        RuntimeException lastFailure = null;

        try (Scope scope = span.makeCurrent()) {
            LOG.infof("Starting cache refresh job %d for %d cities", jobId, cities.size());

            for (String city : cities) {
                LoggingConfig.setCity(city);
                try {
                    cacheRefreshService.refresh(city);
                    successCount++;
                } catch (RuntimeException e) {
                    failureCount++;
                    lastFailure = e;
                    LOG.errorf(e, "Failed to refresh snapshot for %s (continuing)", city);
                }
            }

            span.setAttribute("cities_success", successCount);
            span.setAttribute("cities_failed", failureCount);
            LOG.infof("Cache refresh job %d completed: %d success, %d failures", jobId, successCount, failureCount);

            if (successCount == 0 && lastFailure != null) {
                throw lastFailure;
            }
        } finally {
            span.end();
        }
    }

    private Set<String> targetCities(Map<String, Object> payload) {
        Object requested = payload != null ? payload.get(PAYLOAD_CITY) : null;
        if (requested != null && !requested.toString().isBlank()) {
            return Set.of(requested.toString().trim());
        }

        // Keys are lowercased, so cities differing only by case share a snapshot
        Set<String> seen = new LinkedHashSet<>();
        Set<String> cities = new LinkedHashSet<>();
        for (String city : configuredCities) {
            String trimmed = city.trim();
            if (!trimmed.isEmpty() && seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                cities.add(trimmed);
            }
        }
        return cities;
    }
}
