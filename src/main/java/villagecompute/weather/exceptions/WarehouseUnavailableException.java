/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when the ClickHouse warehouse cannot be reached (connection refused, timeout, pool exhausted).
 *
 * <p>
 * Typically mapped to HTTP 503 Service Unavailable. Callers may retry once the warehouse is back.
 */
public class WarehouseUnavailableException extends WarehouseException {

    public WarehouseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String helpfulMessage() {
        return "ClickHouse is not reachable. Ensure the warehouse is running and QUARKUS_DATASOURCE_JDBC_URL is correct.";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
