/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of {@code POST /api/sync-now}.
 *
 * @param success
 *            whether the snapshot was written
 * @param message
 *            human-readable outcome
 * @param city
 *            city that was refreshed
 * @param timestamp
 *            ISO-8601 time of the response
 * @param dataCount
 *            rows written into the snapshot, omitted on failure
 * @param dataVersion
 *            version token of the new snapshot, omitted on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResultType(boolean success, String message, String city, String timestamp,
        @JsonProperty("data_count") Integer dataCount, @JsonProperty("data_version") String dataVersion) {
}
