package com.vedant.sqlgateway.sql;

/**
 * Result of grafting the tenant predicate onto a query.
 * On failure {@code sql} is empty: there is nothing a caller could fall back to.
 */
public record SecurityFilterResult(boolean success, String sql, String error) {

    public static SecurityFilterResult ok(String sql) {
        return new SecurityFilterResult(true, sql, null);
    }

    public static SecurityFilterResult failed(String error) {
        return new SecurityFilterResult(false, "", error);
    }
}
