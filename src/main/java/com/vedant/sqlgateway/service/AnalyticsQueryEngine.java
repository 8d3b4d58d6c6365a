package com.vedant.sqlgateway.service;

import java.util.List;
import java.util.Map;

/**
 * The analytics database the secured queries run against.
 */
public interface AnalyticsQueryEngine {

    /**
     * Cheap liveness check. Implementations may block; callers bound the wait themselves.
     */
    boolean isReachable();

    /**
     * Runs a read-only query and returns its rows in result-set order, each row keyed by column label.
     *
     * @param timeoutMs statement timeout the engine should enforce on its side as well
     */
    List<Map<String, Object>> query(String sql, int timeoutMs);
}
