package com.vedant.sqlgateway.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

@Service
public class JdbcAnalyticsQueryEngine implements AnalyticsQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(JdbcAnalyticsQueryEngine.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcAnalyticsQueryEngine(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isReachable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException ex) {
            log.warn("Analytics database health check failed: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * Runs {@code sql} in a read-only transaction that is always rolled back, so nothing the
     * statement does can persist.
     */
    @Override
    public List<Map<String, Object>> query(String sql, int timeoutMs) {
        // JDBC timeouts are whole seconds; round up so short limits are not disabled
        int timeoutSeconds = Math.max(1, (timeoutMs + 999) / 1000);
        return jdbcTemplate.execute((ConnectionCallback<List<Map<String, Object>>>) con -> {
            boolean autoCommit = con.getAutoCommit();
            boolean readOnly = con.isReadOnly();
            con.setAutoCommit(false);
            con.setReadOnly(true);
            try (PreparedStatement ps = con.prepareStatement(sql)) {
                ps.setQueryTimeout(timeoutSeconds);
                try (ResultSet rs = ps.executeQuery()) {
                    return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
                }
            } finally {
                con.rollback();
                con.setReadOnly(readOnly);
                con.setAutoCommit(autoCommit);
            }
        });
    }
}
