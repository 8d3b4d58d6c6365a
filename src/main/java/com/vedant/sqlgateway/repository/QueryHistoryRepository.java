package com.vedant.sqlgateway.repository;

import com.vedant.sqlgateway.entity.QueryHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QueryHistoryRepository extends JpaRepository<QueryHistory, Long> {
    List<QueryHistory> findTop50ByUserIdOrderByExecutedAtDesc(String userId);
}
