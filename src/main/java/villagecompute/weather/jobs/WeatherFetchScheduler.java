/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.services.JobDispatcher;

/**
 * Scheduler for Open-Meteo archive fetches.
 *
 * <p>
 * Runs {@link WeatherFetchJobHandler} every hour by default ({@code weather.jobs.weather-fetch.every}).
 *
 * @see WeatherFetchJobHandler
 */
@ApplicationScoped
public class WeatherFetchScheduler {

    private static final Logger LOG = Logger.getLogger(WeatherFetchScheduler.class);

    @Inject
    JobDispatcher jobDispatcher;

    @Scheduled(
            every = "${weather.jobs.weather-fetch.every:1h}",
            delayed = "${weather.jobs.weather-fetch.delayed:30s}")
    void scheduleWeatherFetch() {
        LOG.info("Running scheduled weather fetch job");
        jobDispatcher.dispatch(JobType.WEATHER_FETCH, Map.of());
    }
}
