package com.vedant.sqlgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vedant.sqlgateway.entity.QueryHistory;
import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.exception.QueryExecutionException;
import com.vedant.sqlgateway.exception.QueryRejectedException;
import com.vedant.sqlgateway.repository.QueryHistoryRepository;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.sql.ParseResult;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import com.vedant.sqlgateway.sql.SqlAstParser;
import com.vedant.sqlgateway.sql.TenantFilterInjector;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs secured queries against the analytics engine under a row ceiling and a wall-clock limit.
 * Every attempt, successful or not, leaves a {@link QueryHistory} row.
 */
@Service
public class QueryExecutorService {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutorService.class);

    static final int PREVIEW_ROWS = 50;

    private final QuerySecurityService securityService;
    private final SqlAstParser parser;
    private final AnalyticsQueryEngine engine;
    private final QueryHistoryRepository historyRepository;
    private final ExecutorService queryExecutor;
    private final ExecutorService healthCheckExecutor;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final int defaultRowLimit;
    private final int maxRowLimit;
    private final int defaultTimeoutMs;
    private final int maxTimeoutMs;
    private final int healthCheckTimeoutMs;

    public QueryExecutorService(
            QuerySecurityService securityService,
            SqlAstParser parser,
            AnalyticsQueryEngine engine,
            QueryHistoryRepository historyRepository,
            @Qualifier("queryExecutor") ExecutorService queryExecutor,
            @Qualifier("healthCheckExecutor") ExecutorService healthCheckExecutor,
            Clock clock,
            @Value("${explorer.query.default-row-limit:1000}") int defaultRowLimit,
            @Value("${explorer.query.max-row-limit:10000}") int maxRowLimit,
            @Value("${explorer.query.default-timeout-ms:30000}") int defaultTimeoutMs,
            @Value("${explorer.query.max-timeout-ms:120000}") int maxTimeoutMs,
            @Value("${explorer.query.health-check-timeout-ms:5000}") int healthCheckTimeoutMs
    ) {
        this.securityService = securityService;
        this.parser = parser;
        this.engine = engine;
        this.historyRepository = historyRepository;
        this.queryExecutor = queryExecutor;
        this.healthCheckExecutor = healthCheckExecutor;
        this.clock = clock;
        this.defaultRowLimit = defaultRowLimit;
        this.maxRowLimit = maxRowLimit;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.maxTimeoutMs = maxTimeoutMs;
        this.healthCheckTimeoutMs = healthCheckTimeoutMs;
    }

    /**
     * @throws QueryRejectedException  the query failed validation or could not be scoped to the caller
     * @throws QueryExecutionException the engine was unreachable, timed out or failed
     */
    public ExecuteResult execute(String sql, ExplorerPrincipal principal, ExecuteOptions options) {
        ExecuteOptions opts = options == null ? ExecuteOptions.defaults() : options;
        long started = System.nanoTime();

        QueryHistory history = new QueryHistory();
        history.setUserId(principal == null ? null : principal.userId());
        history.setSubmittedSql(sql);
        history.setExecutedAt(clock.instant());
        history.setStatus(QueryHistory.Status.FAILED);

        try {
            ensureEngineReachable();

            SecuredQuery secured = securityService.secure(sql, principal);
            history.setTablesUsed(toJson(tableNames(secured.tables())));
            if (!secured.success()) {
                throw new QueryRejectedException(secured.errors(), secured.errorKinds());
            }
            history.setTenantFilterBypassed(secured.tenantFilterBypassed());

            String executable = applyRowLimit(secured.sql(), effectiveRowLimit(opts.rowLimit()));
            history.setExecutedSql(executable);

            List<Map<String, Object>> rows = runWithTimeout(executable, effectiveTimeout(opts.timeoutMs()));
            long elapsed = elapsedMs(started);

            history.setStatus(QueryHistory.Status.SUCCESS);
            history.setRowCount(rows.size());
            history.setExecutionTimeMs(elapsed);
            history.setResultPreview(toJson(rows.subList(0, Math.min(PREVIEW_ROWS, rows.size()))));

            log.info("Query executed for user {}: {} rows in {} ms", history.getUserId(), rows.size(), elapsed);
            return new ExecuteResult(rows, rows.size(), elapsed, describeColumns(rows), executable);
        } catch (QueryRejectedException ex) {
            history.setStatus(QueryHistory.Status.REJECTED);
            history.setErrorMessage(String.join("; ", ex.getErrors()));
            throw ex;
        } catch (QueryExecutionException ex) {
            history.setStatus(statusFor(ex.getKind()));
            history.setErrorMessage(ex.getMessage());
            throw ex;
        } finally {
            if (history.getExecutionTimeMs() == null) {
                history.setExecutionTimeMs(elapsedMs(started));
            }
            recordHistory(history);
        }
    }

    // separate pool: queued queries must not delay the health check
    private void ensureEngineReachable() {
        Callable<Boolean> check = engine::isReachable;
        Future<Boolean> future = healthCheckExecutor.submit(check);
        boolean reachable;
        try {
            reachable = Boolean.TRUE.equals(future.get(healthCheckTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Analytics database health check timed out after {} ms", healthCheckTimeoutMs);
            throw new QueryExecutionException(QueryErrorKind.ENGINE_UNREACHABLE,
                    "Analytics database is not responding", ex);
        } catch (ExecutionException ex) {
            log.warn("Analytics database health check failed", ex.getCause());
            throw new QueryExecutionException(QueryErrorKind.ENGINE_UNREACHABLE,
                    "Analytics database is unavailable", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryExecutionException(QueryErrorKind.ENGINE_UNREACHABLE,
                    "Interrupted while checking the analytics database", ex);
        }
        if (!reachable) {
            throw new QueryExecutionException(QueryErrorKind.ENGINE_UNREACHABLE, "Analytics database is unavailable");
        }
    }

    /**
     * Appends a LIMIT when the query has none and clamps one above the ceiling.
     * SQL that already satisfies the ceiling is returned as given.
     */
    String applyRowLimit(String securedSql, int rowLimit) {
        ParseResult reparsed = parser.parse(securedSql);
        Statement statement = reparsed.ast().orElse(null);
        PlainSelect plain = TenantFilterInjector.plainSelectOf(statement);
        if (!reparsed.isValid() || plain == null) {
            log.error("Secured SQL failed re-validation: {}", reparsed.errors());
            throw new QueryRejectedException(List.of("Secured query failed re-validation"),
                    EnumSet.of(QueryErrorKind.FILTER_INJECTION_FAILED));
        }

        if (plain.getFetch() != null) {
            return securedSql;
        }

        Limit limit = plain.getLimit();
        if (limit == null) {
            Limit appended = new Limit();
            appended.setRowCount(new LongValue(rowLimit));
            plain.setLimit(appended);
            return statement.toString();
        }

        Expression rowCount = limit.getRowCount();
        // compared as BigInteger: the literal may not fit in a long
        if (rowCount instanceof LongValue value
                && value.getBigIntegerValue().compareTo(BigInteger.valueOf(maxRowLimit)) <= 0) {
            return securedSql;
        }
        log.debug("Clamping LIMIT {} to {}", rowCount, maxRowLimit);
        limit.setRowCount(new LongValue(maxRowLimit));
        return statement.toString();
    }

    private List<Map<String, Object>> runWithTimeout(String sql, int timeoutMs) {
        Callable<List<Map<String, Object>>> task = () -> engine.query(sql, timeoutMs);
        Future<List<Map<String, Object>>> future = queryExecutor.submit(task);
        try {
            List<Map<String, Object>> rows = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return rows == null ? List.of() : rows;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Query exceeded {} ms and was cancelled", timeoutMs);
            throw new QueryExecutionException(QueryErrorKind.QUERY_TIMEOUT,
                    "Query exceeded the time limit of " + timeoutMs + " ms", ex);
        } catch (ExecutionException ex) {
            log.error("Query execution failed: {}", sql, ex.getCause());
            throw new QueryExecutionException(QueryErrorKind.EXECUTION_FAILED,
                    "Query execution failed; see server logs for details", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryExecutionException(QueryErrorKind.EXECUTION_FAILED, "Query execution was interrupted", ex);
        }
    }

    int effectiveRowLimit(Integer requested) {
        int limit = requested == null || requested <= 0 ? defaultRowLimit : requested;
        return Math.min(limit, maxRowLimit);
    }

    int effectiveTimeout(Integer requested) {
        int timeout = requested == null || requested <= 0 ? defaultTimeoutMs : requested;
        return Math.min(timeout, maxTimeoutMs);
    }

    static List<ColumnInfo> describeColumns(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return List.of();
        List<ColumnInfo> columns = new ArrayList<>();
        for (Map.Entry<String, Object> e : rows.get(0).entrySet()) {
            columns.add(new ColumnInfo(e.getKey(), typeOf(e.getValue())));
        }
        return columns;
    }

    static String typeOf(Object value) {
        if (value == null) return "unknown";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof CharSequence || value instanceof Character) return "string";
        if (value instanceof Date || value instanceof Temporal) return "date";
        if (value instanceof byte[]) return "binary";
        return "unknown";
    }

    private static QueryHistory.Status statusFor(QueryErrorKind kind) {
        return switch (kind) {
            case QUERY_TIMEOUT -> QueryHistory.Status.TIMEOUT;
            case ENGINE_UNREACHABLE -> QueryHistory.Status.UNAVAILABLE;
            default -> QueryHistory.Status.FAILED;
        };
    }

    private void recordHistory(QueryHistory history) {
        try {
            historyRepository.save(history);
        } catch (RuntimeException ex) {
            log.warn("Failed to record query history for user {} (status {})",
                    history.getUserId(), history.getStatus(), ex);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize query history field", ex);
            return null;
        }
    }

    private static List<String> tableNames(List<ParsedTableRef> tables) {
        return tables.stream().map(ParsedTableRef::qualifiedName).distinct().toList();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
