package com.vedant.sqlgateway.exception;

import java.util.List;
import java.util.Set;

/**
 * Carries the full list of validation problems out of the executor, so a caller can show all of them at once.
 */
public class QueryRejectedException extends RuntimeException {

    private final List<String> errors;
    private final Set<QueryErrorKind> errorKinds;

    public QueryRejectedException(List<String> errors, Set<QueryErrorKind> errorKinds) {
        super("Query rejected: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
        this.errorKinds = Set.copyOf(errorKinds);
    }

    public List<String> getErrors() { return errors; }

    public Set<QueryErrorKind> getErrorKinds() { return errorKinds; }
}
