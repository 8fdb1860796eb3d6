/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;

import villagecompute.weather.exceptions.WarehouseException;
import villagecompute.weather.exceptions.WarehouseSchemaMissingException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;

/**
 * Translates JDBC failures from ClickHouse into the warehouse exception hierarchy.
 *
 * <p>
 * <b>Classification:</b>
 * <ul>
 * <li>ClickHouse error 60 (UNKNOWN_TABLE) or 81 (UNKNOWN_DATABASE), or a "doesn't exist" message:
 * {@link WarehouseSchemaMissingException}</li>
 * <li>Socket-level causes, SQLState class 08, connection exceptions, or Agroal acquisition timeouts:
 * {@link WarehouseUnavailableException}</li>
 * <li>Anything else: {@link WarehouseException}</li>
 * </ul>
 */
public final class WarehouseErrors {

    static final int UNKNOWN_TABLE = 60;
    static final int UNKNOWN_DATABASE = 81;

    private WarehouseErrors() {
        // Utility class, no instantiation
    }

    /**
     * Wraps a SQL failure in the matching warehouse exception.
     *
     * @param action
     *            what was being attempted (e.g., "Querying monthly aggregates")
     * @param e
     *            the JDBC failure
     * @return exception to throw
     */
    public static WarehouseException translate(String action, SQLException e) {
        String message = action + " failed: " + e.getMessage();
        if (isSchemaMissing(e)) {
            return new WarehouseSchemaMissingException(message, e);
        }
        if (isConnectivityFailure(e)) {
            return new WarehouseUnavailableException(message, e);
        }
        return new WarehouseException(message, e);
    }

    static boolean isSchemaMissing(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql
                    && (sql.getErrorCode() == UNKNOWN_TABLE || sql.getErrorCode() == UNKNOWN_DATABASE)) {
                return true;
            }
            String text = lower(t.getMessage());
            if (text.contains("unknown_table") || text.contains("unknown_database") || text.contains("doesn't exist")
                    || text.contains("does not exist")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    static boolean isConnectivityFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectException || t instanceof SocketTimeoutException
                    || t instanceof UnknownHostException || t instanceof NoRouteToHostException
                    || t instanceof SQLTransientConnectionException
                    || t instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
                return true;
            }
            String text = lower(t.getMessage());
            if (text.contains("connection refused") || text.contains("connect timed out")
                    || text.contains("acquisition timeout")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String lower(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
