/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.weather.api.types.MonthlyAggregateType;
import villagecompute.weather.exceptions.WarehouseSchemaMissingException;
import villagecompute.weather.exceptions.WarehouseUnavailableException;

/**
 * Unit tests for {@link WarehouseRepository} query binding and row mapping against mocked JDBC objects.
 */
class WarehouseRepositoryTest {

    @Mock
    DataSource dataSource;

    @Mock
    Connection connection;

    @Mock
    PreparedStatement statement;

    @Mock
    ResultSet resultSet;

    private WarehouseRepository repository;

    @BeforeEach
    void setUp() throws SQLException {
        MockitoAnnotations.openMocks(this);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);

        repository = new WarehouseRepository();
        repository.dataSource = dataSource;
    }

    @Test
    void testFindMonthlyByCity_bindsCityAsParameter() throws SQLException {
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("city")).thenReturn("Stockton");
        when(resultSet.getString("month")).thenReturn("2024-01-01");
        when(resultSet.getObject("avg_temp_c")).thenReturn(10.1f);
        when(resultSet.getObject("total_rain_mm")).thenReturn(null);
        when(resultSet.getString("warehouse_load_time")).thenReturn("2024-04-01 00:00:00");

        String hostile = "Stockton' OR '1'='1";
        List<MonthlyAggregateType> rows = repository.findMonthlyByCity(hostile);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertFalse(sql.getValue().contains(hostile));
        assertTrue(sql.getValue().contains("FINAL"));
        assertTrue(sql.getValue().contains("ORDER BY month ASC"));
        verify(statement).setString(1, hostile);

        assertEquals(1, rows.size());
        assertEquals(10.1, rows.get(0).avgTempC());
        assertNull(rows.get(0).totalRainMm());
    }

    @Test
    void testFindAllMonthly_bindsNothing() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertTrue(repository.findAllMonthly().isEmpty());
        verify(statement, never()).setString(1, null);
    }

    @Test
    void testTableExists() throws SQLException {
        when(resultSet.next()).thenReturn(true);

        assertTrue(repository.tableExists(WarehouseRepository.MONTHLY_TABLE));
        verify(statement).setString(1, WarehouseRepository.DATABASE);
        verify(statement).setString(2, WarehouseRepository.MONTHLY_TABLE);
    }

    @Test
    void testFindMonthlyByCity_missingTableTranslated() throws SQLException {
        when(statement.executeQuery())
                .thenThrow(new SQLException("Code: 60. Table weather_dw.monthly_agg doesn't exist", "HY000", 60));

        assertThrows(WarehouseSchemaMissingException.class, () -> repository.findMonthlyByCity("Stockton"));
    }

    @Test
    void testCountMonthly_connectionFailureTranslated() throws SQLException {
        when(dataSource.getConnection())
                .thenThrow(new SQLException("Failed to connect", new ConnectException("Connection refused")));

        assertThrows(WarehouseUnavailableException.class, () -> repository.countMonthly());
    }
}
