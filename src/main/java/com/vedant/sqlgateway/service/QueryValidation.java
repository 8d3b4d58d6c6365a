package com.vedant.sqlgateway.service;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.sql.ParsedTableRef;

import java.util.List;
import java.util.Set;

/**
 * Principal-independent verdict on a query: destructive screen, structure and allow-list.
 */
public record QueryValidation(
        boolean isValid,
        List<String> errors,
        Set<QueryErrorKind> errorKinds,
        List<String> warnings,
        List<ParsedTableRef> tables,
        boolean requiresTenantFilter
) {

    public QueryValidation {
        errors = List.copyOf(errors);
        errorKinds = Set.copyOf(errorKinds);
        warnings = List.copyOf(warnings);
        tables = List.copyOf(tables);
    }
}
