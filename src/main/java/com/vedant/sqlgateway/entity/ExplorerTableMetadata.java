package com.vedant.sqlgateway.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Registry row describing a table that administrators have curated for generated queries.
 * The gateway only reads these rows.
 */
@Entity
@Table(name = "explorer_table_metadata")
public class ExplorerTableMetadata {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "table_metadata_id")
    private UUID id;

    @Column(name = "schema_name", nullable = false)
    private String schemaName = "ih";

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    // lower tier = more trusted
    @Column(name = "tier")
    private Integer tier = 3;

    @Column(name = "is_active")
    private Boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    public ExplorerTableMetadata() {}

    public ExplorerTableMetadata(String schemaName, String tableName, Integer tier) {
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.tier = tier;
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getSchemaName() { return schemaName; }
    public void setSchemaName(String schemaName) { this.schemaName = schemaName; }

    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public Integer getTier() { return tier; }
    public void setTier(Integer tier) { this.tier = tier; }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
