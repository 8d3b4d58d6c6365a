package com.vedant.sqlgateway.service;

import java.util.List;
import java.util.Map;

public record ExecuteResult(
        List<Map<String, Object>> rows,
        int rowCount,
        long executionTimeMs,
        List<ColumnInfo> columns,
        String executedSql
) {

    public ExecuteResult {
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
    }
}
