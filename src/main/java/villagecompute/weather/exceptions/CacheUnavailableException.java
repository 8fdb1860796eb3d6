/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when the snapshot cache cannot be reached (connection refused, timeout, protocol error).
 *
 * <p>
 * Never surfaced to HTTP callers. The serving layer absorbs it and answers from the warehouse instead.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
