package com.vedant.sqlgateway.exception;

/**
 * Execution-stage failure. The message is safe to show to the caller;
 * raw engine diagnostics are only attached as the cause and logged.
 */
public class QueryExecutionException extends RuntimeException {

    private final QueryErrorKind kind;

    public QueryExecutionException(QueryErrorKind kind, String safeMessage) {
        super(safeMessage);
        this.kind = kind;
    }

    public QueryExecutionException(QueryErrorKind kind, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.kind = kind;
    }

    public QueryErrorKind getKind() { return kind; }
}
