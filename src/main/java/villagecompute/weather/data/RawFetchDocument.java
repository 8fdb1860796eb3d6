/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.weather.api.types.FetchMetadataType;

/**
 * Raw archive API response as stored in the raw MongoDB collection, one document per ingest run.
 *
 * @param latitude
 *            requested latitude
 * @param longitude
 *            requested longitude
 * @param start
 *            ISO-8601 start of the requested window
 * @param end
 *            ISO-8601 end of the requested window
 * @param fetchedAt
 *            ISO-8601 instant the response was received
 * @param city
 *            city name
 * @param state
 *            state code
 * @param metadata
 *            batch provenance shared with the enriched documents
 * @param payload
 *            untouched API response body
 */
public record RawFetchDocument(double latitude, double longitude, String start, String end,
        @JsonProperty("fetched_at") String fetchedAt, String city, String state, FetchMetadataType metadata,
        JsonNode payload) {
}
