package com.vedant.sqlgateway.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "explorer_query_history")
public class QueryHistory {

    public enum Status { SUCCESS, REJECTED, TIMEOUT, FAILED, UNAVAILABLE }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "submitted_sql", columnDefinition = "text", nullable = false)
    private String submittedSql;

    // SQL actually sent to the engine, null when it never got that far
    @Column(name = "executed_sql", columnDefinition = "text")
    private String executedSql;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status;

    @Column(name = "row_count")
    private Integer rowCount;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "tables_used", columnDefinition = "text")
    private String tablesUsed;

    @Column(name = "tenant_filter_bypassed", nullable = false)
    private boolean tenantFilterBypassed;

    // Small preview or JSON of results (truncated)
    @Column(name = "result_preview", columnDefinition = "text")
    private String resultPreview;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt = Instant.now();

    public QueryHistory() {}

    // Getters / setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getSubmittedSql() { return submittedSql; }
    public void setSubmittedSql(String submittedSql) { this.submittedSql = submittedSql; }

    public String getExecutedSql() { return executedSql; }
    public void setExecutedSql(String executedSql) { this.executedSql = executedSql; }

    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getTablesUsed() { return tablesUsed; }
    public void setTablesUsed(String tablesUsed) { this.tablesUsed = tablesUsed; }

    public boolean isTenantFilterBypassed() { return tenantFilterBypassed; }
    public void setTenantFilterBypassed(boolean tenantFilterBypassed) { this.tenantFilterBypassed = tenantFilterBypassed; }

    public String getResultPreview() { return resultPreview; }
    public void setResultPreview(String resultPreview) { this.resultPreview = resultPreview; }

    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }
}
