/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.api.rest;

import jakarta.ws.rs.core.Response;
import villagecompute.weather.api.types.ErrorResponseType;
import villagecompute.weather.exceptions.WarehouseException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;

/**
 * Builds {@link ErrorResponseType} responses for warehouse failures.
 *
 * <p>
 * <b>Status Mapping:</b>
 * <ul>
 * <li>{@link WarehouseUnavailableException}: 503 Service Unavailable, retryable</li>
 * <li>{@link villagecompute.weather.exceptions.WarehouseSchemaMissingException}: 500 with a load-job hint</li>
 * <li>Other {@link WarehouseException}: 500</li>
 * <li>Unexpected exceptions: 500</li>
 * </ul>
 */
final class ErrorResponses {

    static final String SOURCE_ERROR = "error";

    private ErrorResponses() {
        // Utility class, no instantiation
    }

    static Response warehouse(String error, WarehouseException e) {
        Response.Status status = e instanceof WarehouseUnavailableException
                ? Response.Status.SERVICE_UNAVAILABLE
                : Response.Status.INTERNAL_SERVER_ERROR;
        return Response.status(status)
                .entity(new ErrorResponseType(error, e.getMessage(), e.helpfulMessage(), SOURCE_ERROR, e.retryable()))
                .build();
    }

    static Response unexpected(String error, Exception e) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(new ErrorResponseType(error, e.getMessage(), "Check server logs for details", SOURCE_ERROR,
                        false))
                .build();
    }
}
