package com.vedant.sqlgateway.dto;

import com.vedant.sqlgateway.service.ColumnInfo;

import java.util.List;
import java.util.Map;

public class QueryResponseDTO {
    private String sql;
    private List<Map<String, Object>> rows;
    private List<ColumnInfo> columns;
    private Integer rowCount;
    private Long executionTimeMs;
    private String message;
    private String errorKind;
    private List<String> errors;

    public QueryResponseDTO() {}

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public List<Map<String, Object>> getRows() { return rows; }
    public void setRows(List<Map<String, Object>> rows) { this.rows = rows; }

    public List<ColumnInfo> getColumns() { return columns; }
    public void setColumns(List<ColumnInfo> columns) { this.columns = columns; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getErrorKind() { return errorKind; }
    public void setErrorKind(String errorKind) { this.errorKind = errorKind; }

    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
