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
 * Scheduler for MongoDB to ClickHouse loads.
 *
 * <p>
 * Runs {@link WarehouseLoadJobHandler} every hour ({@code weather.jobs.warehouse-load.every}), first firing a few
 * minutes after startup so it follows the initial fetch.
 *
 * @see WarehouseLoadJobHandler
 */
@ApplicationScoped
public class WarehouseLoadScheduler {

    private static final Logger LOG = Logger.getLogger(WarehouseLoadScheduler.class);

    @Inject
    JobDispatcher jobDispatcher;

    @Scheduled(
            every = "${weather.jobs.warehouse-load.every:1h}",
            delayed = "${weather.jobs.warehouse-load.delayed:5m}")
    void scheduleWarehouseLoad() {
        LOG.info("Running scheduled warehouse load job");
        jobDispatcher.dispatch(JobType.WAREHOUSE_LOAD, Map.of());
    }
}
