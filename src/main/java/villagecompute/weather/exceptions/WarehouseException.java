/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when a warehouse query fails for a reason other than connectivity or missing schema.
 *
 * <p>
 * Base type for all warehouse failures. Extends RuntimeException per project standards. Typically mapped to HTTP 500
 * Internal Server Error in REST resources.
 *
 * @see WarehouseUnavailableException
 * @see WarehouseSchemaMissingException
 */
public class WarehouseException extends RuntimeException {

    public WarehouseException(String message) {
        super(message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Operator-facing hint describing how to resolve the failure.
     *
     * @return remediation hint shown as {@code helpful_message} in error responses
     */
    public String helpfulMessage() {
        return "Check server logs for details";
    }

    /**
     * Whether retrying the same request later may succeed.
     *
     * @return true for transient failures
     */
    public boolean retryable() {
        return false;
    }
}
