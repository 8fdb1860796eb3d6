/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one stage of the warehouse diagnostics report.
 *
 * @param status
 *            "success", "warning" or "error"
 * @param message
 *            human-readable description, including remediation for warnings
 * @param rowCount
 *            total rows in {@code monthly_agg}, data stage only
 * @param sampleData
 *            first row for the probed city, sample stage only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticCheckType(String status, String message, @JsonProperty("row_count") Long rowCount,
        @JsonProperty("sample_data") MonthlyAggregateType sampleData) {

    public static DiagnosticCheckType success(String message) {
        return new DiagnosticCheckType("success", message, null, null);
    }

    public static DiagnosticCheckType warning(String message) {
        return new DiagnosticCheckType("warning", message, null, null);
    }

    public static DiagnosticCheckType error(String message) {
        return new DiagnosticCheckType("error", message, null, null);
    }
}
