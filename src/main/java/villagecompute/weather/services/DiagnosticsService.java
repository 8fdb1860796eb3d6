/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.services;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.DiagnosticCheckType;
import villagecompute.weather.api.types.DiagnosticsType;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.data.WarehouseRepository;
import villagecompute.weather.exceptions.WarehouseException;

/**
 * Staged health report of the ClickHouse warehouse.
 *
 * <h2>Checks (in order)</h2>
 * <ol>
 * <li>{@code connection}: SELECT 1; an error ends the report</li>
 * <li>{@code database}: {@code weather_dw} exists; absence ends the report</li>
 * <li>{@code table}: {@code monthly_agg} exists; absence ends the report</li>
 * <li>{@code data}: deduplicated row count</li>
 * <li>{@code sample_query}: first row for the requested city</li>
 * </ol>
 * Failures are reported inside the check map, never thrown.
 */
@ApplicationScoped
public class DiagnosticsService {

    private static final Logger LOG = Logger.getLogger(DiagnosticsService.class);

    private static final String REMEDIATION = "Run the WAREHOUSE_LOAD job.";

    @Inject
    WarehouseRepository warehouseRepository;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "quarkus.datasource.jdbc.url",
            defaultValue = "jdbc:clickhouse://localhost:8123/default")
    String warehouseUrl;

    /**
     * Runs the staged checks.
     *
     * @param city
     *            city used for the sample query
     * @return report with one entry per executed check
     */
    public DiagnosticsType run(String city) {
        Map<String, DiagnosticCheckType> checks = new LinkedHashMap<>();
        DiagnosticsType report = new DiagnosticsType(clock.instant().toString(), warehouseUrl, checks);

        try {
            warehouseRepository.ping();
            checks.put("connection", DiagnosticCheckType.success("ClickHouse connection successful"));
        } catch (WarehouseException e) {
            LOG.warnf("Diagnostics: ClickHouse unreachable: %s", e.getMessage());
            checks.put("connection", DiagnosticCheckType.error("Cannot connect to ClickHouse: " + e.getMessage()));
            return report;
        }

        try {
            if (!warehouseRepository.databaseExists()) {
                checks.put("database", DiagnosticCheckType
                        .warning(WarehouseRepository.DATABASE + " database does not exist. " + REMEDIATION));
                return report;
            }
            checks.put("database", DiagnosticCheckType.success(WarehouseRepository.DATABASE + " database exists"));
        } catch (WarehouseException e) {
            checks.put("database", DiagnosticCheckType.error("Error checking database: " + e.getMessage()));
        }

        try {
            if (!warehouseRepository.tableExists(WarehouseRepository.MONTHLY_TABLE)) {
                checks.put("table", DiagnosticCheckType
                        .warning(WarehouseRepository.MONTHLY_TABLE + " table does not exist. " + REMEDIATION));
                return report;
            }
            checks.put("table", DiagnosticCheckType.success(WarehouseRepository.MONTHLY_TABLE + " table exists"));
        } catch (WarehouseException e) {
            checks.put("table", DiagnosticCheckType.error("Error checking table: " + e.getMessage()));
        }

        try {
            long total = warehouseRepository.countMonthly();
            checks.put("data", total > 0
                    ? new DiagnosticCheckType("success", "Table has " + total + " rows", total, null)
                    : new DiagnosticCheckType("warning", "Table exists but has no data. " + REMEDIATION, total,
                            null));
        } catch (WarehouseException e) {
            checks.put("data", DiagnosticCheckType.error("Error counting rows: " + e.getMessage()));
        }

        try {
            Optional<MonthlyAggregateType> sample = warehouseRepository.findFirstMonthlyByCity(city);
            checks.put("sample_query", sample.isPresent()
                    ? new DiagnosticCheckType("success", "Sample query successful", null, sample.get())
                    : DiagnosticCheckType.warning("No data found for " + city + ". " + REMEDIATION));
        } catch (WarehouseException e) {
            checks.put("sample_query", DiagnosticCheckType.error("Error running sample query: " + e.getMessage()));
        }

        return report;
    }
}
