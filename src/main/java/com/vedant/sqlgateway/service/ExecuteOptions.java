package com.vedant.sqlgateway.service;

/**
 * Per-call execution knobs. A null value means "use the configured default".
 */
public record ExecuteOptions(Integer rowLimit, Integer timeoutMs) {

    public static ExecuteOptions defaults() {
        return new ExecuteOptions(null, null);
    }
}
