package com.vedant.sqlgateway.dto;

public class QueryRequestDTO {
    private String sql;
    private Integer rowLimit;   // optional, capped server-side
    private Integer timeoutMs;  // optional, capped server-side

    public QueryRequestDTO() {}

    public QueryRequestDTO(String sql) {
        this.sql = sql;
    }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public Integer getRowLimit() { return rowLimit; }
    public void setRowLimit(Integer rowLimit) { this.rowLimit = rowLimit; }

    public Integer getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(Integer timeoutMs) { this.timeoutMs = timeoutMs; }
}
