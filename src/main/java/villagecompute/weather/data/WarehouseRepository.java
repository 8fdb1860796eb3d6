/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.util.MeasurementValues;

/**
 * JDBC access to the ClickHouse {@code weather_dw} warehouse.
 *
 * <h2>Schema</h2>
 * <ul>
 * <li>{@code daily_weather}: hourly observations, ReplacingMergeTree keyed by (city, observed_at)</li>
 * <li>{@code monthly_agg}: monthly averages/totals, ReplacingMergeTree keyed by (city, month)</li>
 * </ul>
 * Both engines keep the row with the latest {@code warehouse_load_time} per key, and every read uses {@code FINAL}, so
 * repeated loads never surface duplicate (city, month) rows.
 *
 * <p>
 * All user-supplied values are bound through {@link PreparedStatement} parameters. SQL failures are translated by
 * {@link WarehouseErrors} into unreachable / schema-missing / generic warehouse exceptions.
 */
@ApplicationScoped
public class WarehouseRepository {

    private static final Logger LOG = Logger.getLogger(WarehouseRepository.class);

    public static final String DATABASE = "weather_dw";
    public static final String DAILY_TABLE = "daily_weather";
    public static final String MONTHLY_TABLE = "monthly_agg";

    private static final String CREATE_DATABASE = "CREATE DATABASE IF NOT EXISTS weather_dw";

    private static final String CREATE_DAILY_TABLE = """
            CREATE TABLE IF NOT EXISTS weather_dw.daily_weather
            (
                observed_at DateTime,
                date Date,
                temperatureC Nullable(Float32),
                temperatureF Nullable(Float32),
                humidityPercent Nullable(Float32),
                rainfallMm Nullable(Float32),
                windSpeedMps Nullable(Float32),
                windGustMps Nullable(Float32),
                city String,
                state String,
                source_timestamp Nullable(DateTime),
                source_database String,
                data_quality String,
                api_request_id String,
                etl_batch_id String,
                author String,
                warehouse_load_time DateTime,
                rows_loaded UInt32,
                sync_interval_min UInt16,
                load_mode LowCardinality(String)
            )
            ENGINE = ReplacingMergeTree(warehouse_load_time)
            PARTITION BY toYYYYMM(date)
            ORDER BY (city, observed_at)
            """;

    private static final String CREATE_MONTHLY_TABLE = """
            CREATE TABLE IF NOT EXISTS weather_dw.monthly_agg
            (
                city String,
                month Date,
                avg_temp_c Nullable(Float32),
                total_rain_mm Nullable(Float32),
                warehouse_load_time DateTime,
                rows_loaded UInt32,
                load_mode LowCardinality(String),
                sync_interval_min UInt16
            )
            ENGINE = ReplacingMergeTree(warehouse_load_time)
            PARTITION BY toYYYYMM(month)
            ORDER BY (city, month)
            """;

    private static final String INSERT_DAILY = """
            INSERT INTO weather_dw.daily_weather
            (observed_at, date, temperatureC, temperatureF, humidityPercent, rainfallMm, windSpeedMps, windGustMps,
             city, state, source_timestamp, source_database, data_quality, api_request_id, etl_batch_id, author,
             warehouse_load_time, rows_loaded, sync_interval_min, load_mode)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    // sync_interval_min is an operator-configured integer, never request input
    private static final String REBUILD_MONTHLY = """
            INSERT INTO weather_dw.monthly_agg
            SELECT
                city,
                toStartOfMonth(date) AS month,
                avg(temperatureC) AS avg_temp_c,
                sum(rainfallMm) AS total_rain_mm,
                now() AS warehouse_load_time,
                toUInt32(count()) AS rows_loaded,
                'incremental' AS load_mode,
                toUInt16(%d) AS sync_interval_min
            FROM weather_dw.daily_weather FINAL
            GROUP BY city, month
            """;

    private static final String SELECT_MONTHLY_COLUMNS = "SELECT city, month, avg_temp_c, total_rain_mm, "
            + "warehouse_load_time FROM weather_dw.monthly_agg FINAL";

    @Inject
    DataSource dataSource;

    /**
     * Creates the warehouse database and tables if they do not exist.
     */
    public void ensureSchema() {
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(CREATE_DATABASE);
            statement.execute(CREATE_DAILY_TABLE);
            statement.execute(CREATE_MONTHLY_TABLE);
            LOG.debug("Warehouse schema ensured");
        } catch (SQLException e) {
            throw WarehouseErrors.translate("Creating warehouse schema", e);
        }
    }

    /**
     * Batch-inserts hourly observations into {@code daily_weather}.
     *
     * @param rows
     *            rows to insert
     * @return number of rows sent
     */
    public int insertDailyWeather(List<DailyWeatherRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }

        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(INSERT_DAILY)) {
            for (DailyWeatherRow row : rows) {
                int i = 1;
                statement.setObject(i++, row.observedAt());
                statement.setObject(i++, row.date());
                setNullableDouble(statement, i++, row.temperatureC());
                setNullableDouble(statement, i++, row.temperatureF());
                setNullableDouble(statement, i++, row.humidityPercent());
                setNullableDouble(statement, i++, row.rainfallMm());
                setNullableDouble(statement, i++, row.windSpeedMps());
                setNullableDouble(statement, i++, row.windGustMps());
                statement.setString(i++, row.city());
                statement.setString(i++, nullToEmpty(row.state()));
                if (row.sourceTimestamp() != null) {
                    statement.setObject(i++, row.sourceTimestamp());
                } else {
                    statement.setNull(i++, Types.TIMESTAMP);
                }
                statement.setString(i++, nullToEmpty(row.sourceDatabase()));
                statement.setString(i++, nullToEmpty(row.dataQuality()));
                statement.setString(i++, nullToEmpty(row.apiRequestId()));
                statement.setString(i++, nullToEmpty(row.etlBatchId()));
                statement.setString(i++, nullToEmpty(row.author()));
                statement.setObject(i++, row.warehouseLoadTime());
                statement.setInt(i++, row.rowsLoaded());
                statement.setInt(i++, row.syncIntervalMin());
                statement.setString(i, row.loadMode());
                statement.addBatch();
            }
            statement.executeBatch();
            LOG.debugf("Inserted %d rows into %s.%s", rows.size(), DATABASE, DAILY_TABLE);
            return rows.size();
        } catch (SQLException e) {
            throw WarehouseErrors.translate("Inserting daily weather", e);
        }
    }

    /**
     * Re-aggregates {@code monthly_agg} from {@code daily_weather}.
     *
     * @param syncIntervalMin
     *            sync interval recorded on each aggregate row
     */
    public void rebuildMonthlyAggregates(int syncIntervalMin) {
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(String.format(REBUILD_MONTHLY, syncIntervalMin));
        } catch (SQLException e) {
            throw WarehouseErrors.translate("Rebuilding monthly aggregates", e);
        }
    }

    /**
     * Reads every monthly aggregate, ordered by city then month.
     *
     * @return all rows
     */
    public List<MonthlyAggregateType> findAllMonthly() {
        return queryMonthly(SELECT_MONTHLY_COLUMNS + " ORDER BY city, month", null, "Querying all monthly aggregates");
    }

    /**
     * Reads the monthly aggregates of one city, ordered by month ascending. Matching is case-insensitive, consistent
     * with the lowercased cache key.
     *
     * @param city
     *            city name
     * @return rows for the city, empty if none
     */
    public List<MonthlyAggregateType> findMonthlyByCity(String city) {
        return queryMonthly(SELECT_MONTHLY_COLUMNS + " WHERE lower(city) = lower(?) ORDER BY month ASC", city,
                "Querying monthly aggregates for " + city);
    }

    /**
     * Reads the earliest monthly aggregate of one city.
     *
     * @param city
     *            city name
     * @return first row, empty if the city has no data
     */
    public Optional<MonthlyAggregateType> findFirstMonthlyByCity(String city) {
        List<MonthlyAggregateType> rows = queryMonthly(
                SELECT_MONTHLY_COLUMNS + " WHERE lower(city) = lower(?) ORDER BY month ASC LIMIT 1", city,
                "Sampling monthly aggregates for " + city);
        return rows.stream().findFirst();
    }

    /**
     * Counts monthly aggregate rows after deduplication.
     *
     * @return row count
     */
    public long countMonthly() {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection
                        .prepareStatement("SELECT count() AS total FROM weather_dw.monthly_agg FINAL");
                ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong("total") : 0L;
        } catch (SQLException e) {
            throw WarehouseErrors.translate("Counting monthly aggregates", e);
        }
    }

    /**
     * Runs {@code SELECT 1} to verify connectivity.
     */
    public void ping() {
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT 1")) {
            rs.next();
        } catch (SQLException e) {
            throw WarehouseErrors.translate("Connecting to ClickHouse", e);
        }
    }

    /**
     * @return true if the {@code weather_dw} database exists
     */
    public boolean databaseExists() {
        return exists("SELECT name FROM system.databases WHERE name = ?", List.of(DATABASE),
                "Checking warehouse database");
    }

    /**
     * @param table
     *            table name inside {@code weather_dw}
     * @return true if the table exists
     */
    public boolean tableExists(String table) {
        return exists("SELECT name FROM system.tables WHERE database = ? AND name = ?", List.of(DATABASE, table),
                "Checking warehouse table " + table);
    }

    private boolean exists(String sql, List<String> params, String action) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setString(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw WarehouseErrors.translate(action, e);
        }
    }

    private List<MonthlyAggregateType> queryMonthly(String sql, String city, String action) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            if (city != null) {
                statement.setString(1, city);
            }
            List<MonthlyAggregateType> rows = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapMonthly(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw WarehouseErrors.translate(action, e);
        }
    }

    private MonthlyAggregateType mapMonthly(ResultSet rs) throws SQLException {
        return new MonthlyAggregateType(rs.getString("city"), rs.getString("month"),
                MeasurementValues.toDoubleOrNull(rs.getObject("avg_temp_c")),
                MeasurementValues.toDoubleOrNull(rs.getObject("total_rain_mm")), rs.getString("warehouse_load_time"));
    }

    private static void setNullableDouble(PreparedStatement statement, int index, Double value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.FLOAT);
        } else {
            statement.setDouble(index, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
