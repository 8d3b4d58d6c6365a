package com.vedant.sqlgateway.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcAnalyticsQueryEngineTest {

    private static final String SQL = "SELECT a FROM ih.x WHERE practice_uid = 1 LIMIT 1000";

    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private JdbcAnalyticsQueryEngine engine;

    @BeforeEach
    void setUp() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.isReadOnly()).thenReturn(false);
        when(connection.prepareStatement(SQL)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);
        engine = new JdbcAnalyticsQueryEngine(new JdbcTemplate(dataSource));
    }

    @Test
    void queryRunsInsideReadOnlyTransactionThatIsRolledBack() throws SQLException {
        List<Map<String, Object>> rows = engine.query(SQL, 1500);

        assertTrue(rows.isEmpty());
        InOrder order = inOrder(connection, statement);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).setReadOnly(true);
        order.verify(statement).setQueryTimeout(2);
        order.verify(statement).executeQuery();
        order.verify(connection).rollback();
        verify(connection, never()).commit();
    }

    @Test
    void connectionStateIsRestoredWhenTheQueryFails() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("cannot execute nextval() in a read-only transaction"));

        assertThrows(RuntimeException.class, () -> engine.query(SQL, 1000));

        verify(connection).rollback();
        verify(connection).setReadOnly(false);
        verify(connection).setAutoCommit(true);
    }
}
