/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.exceptions;

/**
 * Exception thrown when the {@code weather_dw} database or one of its tables does not exist.
 *
 * <p>
 * Distinct from {@link WarehouseUnavailableException}: the warehouse answered, but the load job has never provisioned
 * the schema. Mapped to HTTP 500 with a remediation hint.
 */
public class WarehouseSchemaMissingException extends WarehouseException {

    public WarehouseSchemaMissingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String helpfulMessage() {
        return "The weather_dw schema is missing. Run the WAREHOUSE_LOAD job to provision and populate it.";
    }
}
