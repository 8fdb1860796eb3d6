/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance attached to every document written by one ingest run.
 *
 * @param sourceTimestamp
 *            ISO-8601 instant the archive API was queried
 * @param sourceDatabase
 *            upstream dataset identifier ("open-meteo.com/archive")
 * @param dataQuality
 *            quality marker ("as-provided")
 * @param apiRequestId
 *            upstream request id when the API provides one, null otherwise
 * @param etlBatchId
 *            batch identifier shared by all documents of the run ("etl-&lt;epoch millis&gt;")
 * @param author
 *            team or operator recorded as author of the batch
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FetchMetadataType(@JsonProperty("source_timestamp") String sourceTimestamp,
        @JsonProperty("source_database") String sourceDatabase, @JsonProperty("data_quality") String dataQuality,
        @JsonProperty("api_request_id") String apiRequestId, @JsonProperty("etl_batch_id") String etlBatchId,
        String author) {
}
