/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of {@code GET /api/diagnostics}.
 *
 * @param timestamp
 *            ISO-8601 time the report was produced
 * @param warehouseUrl
 *            JDBC URL of the warehouse being probed
 * @param checks
 *            stage name to outcome, in execution order; later stages are absent when an earlier one stopped the run
 */
public record DiagnosticsType(String timestamp, @JsonProperty("warehouse_url") String warehouseUrl,
        Map<String, DiagnosticCheckType> checks) {
}
