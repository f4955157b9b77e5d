package com.marketpulse.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class JdbcCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        store = new JdbcCheckpointStore(dataSource, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("createTables issues table and index DDL")
    void createTables() throws SQLException {
        store.createTables();

        verify(connection).prepareStatement(contains("CREATE TABLE IF NOT EXISTS marketpulse_checkpoints"));
        verify(connection).prepareStatement(contains("CREATE INDEX IF NOT EXISTS"));
        verify(statement, times(2)).execute();
    }

    @Test
    @DisplayName("append inserts the serialized payload and returns the generated id as sequence")
    void appendInserts() throws SQLException {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(42L);

        var checkpoint = store.append("S1", "quality_gate", "research", Map.of("score", 60));

        assertEquals(42L, checkpoint.sequence());
        assertEquals("{\"score\":60}", checkpoint.payload());
        verify(statement).setString(1, "S1");
        verify(statement).setString(2, "research");
        verify(statement).setString(3, "quality_gate");
        verify(statement).setString(4, "{\"score\":60}");
        verify(statement).setTimestamp(5, Timestamp.from(NOW));
    }

    @Test
    @DisplayName("SQL failure on append raises CheckpointWriteException")
    void appendFailure() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("connection reset"));

        var ex = assertThrows(CheckpointWriteException.class,
                () -> store.append("S1", "research_data", "research", Map.of()));
        assertInstanceOf(SQLException.class, ex.getCause());
    }

    @Test
    @DisplayName("readSession maps rows in id order")
    void readSessionMapsRows() throws SQLException {
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString("session_id")).thenReturn("S1", "S1");
        when(resultSet.getLong("id")).thenReturn(1L, 2L);
        when(resultSet.getString("stage")).thenReturn("research", "research");
        when(resultSet.getString("category")).thenReturn("research_data", "quality_gate");
        when(resultSet.getString("payload")).thenReturn("{}", "{\"passed\":false}");
        when(resultSet.getTimestamp("created_at")).thenReturn(Timestamp.from(NOW), Timestamp.from(NOW));

        var checkpoints = store.readSession("S1");

        assertEquals(2, checkpoints.size());
        assertEquals(List.of("research_data", "quality_gate"),
                checkpoints.stream().map(c -> c.category()).toList());
        assertEquals(NOW, checkpoints.get(1).timestamp());
        verify(connection).prepareStatement(contains("ORDER BY id ASC"));
    }

    @Test
    @DisplayName("readSession returns empty on SQL failure")
    void readSessionFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("down"));

        assertTrue(store.readSession("S1").isEmpty());
        assertTrue(store.listSessions().isEmpty());
    }

    @Test
    @DisplayName("isReachable validates a connection")
    void reachability() throws SQLException {
        when(connection.isValid(anyInt())).thenReturn(true);
        assertTrue(store.isReachable(5));

        when(dataSource.getConnection()).thenThrow(new SQLException("down"));
        assertFalse(store.isReachable(5));
    }
}
