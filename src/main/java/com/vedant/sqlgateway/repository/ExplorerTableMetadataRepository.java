package com.vedant.sqlgateway.repository;

import com.vedant.sqlgateway.entity.ExplorerTableMetadata;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExplorerTableMetadataRepository extends JpaRepository<ExplorerTableMetadata, UUID> {
    List<ExplorerTableMetadata> findByActiveTrue();
}
