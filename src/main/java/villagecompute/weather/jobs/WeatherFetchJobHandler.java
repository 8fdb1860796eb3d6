/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.services.WeatherIngestService;

/**
 * Job handler that pulls recent hourly history from the Open-Meteo archive into MongoDB.
 *
 * <p>
 * The payload is ignored; location and window come from {@code weather.location.*} and
 * {@code weather.ingest.hours-back}. An archive failure fails the job and nothing is written for that run.
 *
 * @see WeatherIngestService#ingest()
 */
@ApplicationScoped
public class WeatherFetchJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(WeatherFetchJobHandler.class);

    @Inject
    WeatherIngestService weatherIngestService;

    @Override
    public JobType handlesType() {
        return JobType.WEATHER_FETCH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        LOG.infof("Starting weather fetch job %d", jobId);
        int stored = weatherIngestService.ingest();
        LOG.infof("Weather fetch job %d stored %d observations", jobId, stored);
    }
}
