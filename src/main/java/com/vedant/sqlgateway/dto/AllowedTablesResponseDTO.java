package com.vedant.sqlgateway.dto;

import java.time.Instant;
import java.util.List;

public class AllowedTablesResponseDTO {
    private List<String> tables;
    private Integer tableCount;
    private Instant capturedAt;

    public AllowedTablesResponseDTO() {}

    public AllowedTablesResponseDTO(List<String> tables, Integer tableCount, Instant capturedAt) {
        this.tables = tables;
        this.tableCount = tableCount;
        this.capturedAt = capturedAt;
    }

    public List<String> getTables() { return tables; }
    public void setTables(List<String> tables) { this.tables = tables; }

    public Integer getTableCount() { return tableCount; }
    public void setTableCount(Integer tableCount) { this.tableCount = tableCount; }

    public Instant getCapturedAt() { return capturedAt; }
    public void setCapturedAt(Instant capturedAt) { this.capturedAt = capturedAt; }
}
