/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint on failure.
 *
 * @param error
 *            short summary of what failed
 * @param message
 *            underlying error message
 * @param helpfulMessage
 *            remediation hint for operators
 * @param source
 *            always "error"
 * @param retryable
 *            true when the same request may succeed later (e.g., warehouse restarting)
 */
public record ErrorResponseType(String error, String message, @JsonProperty("helpful_message") String helpfulMessage,
        String source, boolean retryable) {
}
