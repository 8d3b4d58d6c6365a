package com.vedant.sqlgateway.service;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.sql.ParsedTableRef;

import java.util.List;
import java.util.Set;

/**
 * SQL that is safe to hand to the engine for one principal, or the reasons it is not.
 * {@code sql} is empty whenever {@code success} is false.
 */
public record SecuredQuery(
        boolean success,
        String sql,
        List<String> errors,
        Set<QueryErrorKind> errorKinds,
        List<ParsedTableRef> tables,
        boolean tenantFilterBypassed
) {

    public SecuredQuery {
        errors = List.copyOf(errors);
        errorKinds = Set.copyOf(errorKinds);
        tables = List.copyOf(tables);
    }

    static SecuredQuery accepted(String sql, List<ParsedTableRef> tables, boolean bypassed) {
        return new SecuredQuery(true, sql, List.of(), Set.of(), tables, bypassed);
    }

    static SecuredQuery rejected(List<String> errors, Set<QueryErrorKind> kinds, List<ParsedTableRef> tables) {
        return new SecuredQuery(false, "", errors, kinds, tables, false);
    }
}
