/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.services.WarehouseLoadService;

/**
 * Job handler that loads enriched observations into ClickHouse and rebuilds {@code weather_dw.monthly_agg}.
 *
 * @see WarehouseLoadService#load()
 */
@ApplicationScoped
public class WarehouseLoadJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(WarehouseLoadJobHandler.class);

    @Inject
    WarehouseLoadService warehouseLoadService;

    @Override
    public JobType handlesType() {
        return JobType.WAREHOUSE_LOAD;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        LOG.infof("Starting warehouse load job %d", jobId);
        int rows = warehouseLoadService.load();
        LOG.infof("Warehouse load job %d loaded %d rows", jobId, rows);
    }
}
