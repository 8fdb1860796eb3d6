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
 * Scheduler for Redis snapshot refreshes.
 *
 * <p>
 * Runs {@link CacheRefreshJobHandler} for all configured cities every 30 minutes by default
 * ({@code weather.jobs.cache-refresh.every}). With the default one hour TTL a snapshot is rewritten before it drops
 * into the out-of-sync band.
 *
 * @see CacheRefreshJobHandler
 */
@ApplicationScoped
public class CacheRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(CacheRefreshScheduler.class);

    @Inject
    JobDispatcher jobDispatcher;

    @Scheduled(
            every = "${weather.jobs.cache-refresh.every:30m}",
            delayed = "${weather.jobs.cache-refresh.delayed:6m}")
    void scheduleCacheRefresh() {
        LOG.info("Running scheduled cache refresh job");
        jobDispatcher.dispatch(JobType.CACHE_REFRESH, Map.of());
    }
}
