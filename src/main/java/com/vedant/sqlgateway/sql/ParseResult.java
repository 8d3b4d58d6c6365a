package com.vedant.sqlgateway.sql;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import net.sf.jsqlparser.statement.Statement;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of {@link SqlAstParser#parse(String)}.
 * {@code ast} is present whenever the text parsed into a single statement, valid or not.
 */
public record ParseResult(
        List<String> errors,
        Set<QueryErrorKind> errorKinds,
        Optional<Statement> ast,
        List<ParsedTableRef> tables,
        boolean hasUnion,
        boolean hasSubquery,
        String statementKind
) {

    public ParseResult {
        errors = List.copyOf(errors);
        errorKinds = Set.copyOf(errorKinds);
        tables = List.copyOf(tables);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
