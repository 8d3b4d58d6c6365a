package com.vedant.sqlgateway.sql;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adds the row-level tenant predicate on {@code practice_uid} to a parsed SELECT and re-serializes it.
 * The AST passed in is modified in place.
 */
@Component
public class TenantFilterInjector {

    private static final Logger log = LoggerFactory.getLogger(TenantFilterInjector.class);

    public static final String TENANT_COLUMN = "practice_uid";

    public SecurityFilterResult injectTenantFilter(Statement ast, List<Integer> tenantIds) {
        if (tenantIds == null || tenantIds.isEmpty()) {
            return fail("no tenant ids supplied");
        }
        if (tenantIds.stream().anyMatch(Objects::isNull)) {
            return fail("tenant id list contains null");
        }

        PlainSelect target = plainSelectOf(ast);
        if (target == null) {
            String kind = ast == null ? "none" : ast.getClass().getSimpleName();
            return fail("expected a plain SELECT, got " + kind);
        }

        try {
            Expression tenantPredicate = buildTenantPredicate(tenantIds);
            Expression existing = target.getWhere();
            if (existing == null) {
                target.setWhere(tenantPredicate);
            } else {
                // existing predicate stays on the left; parentheses keep an OR from absorbing the filter
                target.setWhere(new AndExpression(parenthesize(existing), parenthesize(tenantPredicate)));
            }

            String securedSql = ast.toString();
            if (securedSql == null || securedSql.isBlank()) {
                return fail("serialization produced no SQL");
            }
            return SecurityFilterResult.ok(securedSql);
        } catch (RuntimeException ex) {
            log.error("Failed to inject security filter for {} tenant(s)", tenantIds.size(), ex);
            return SecurityFilterResult.failed("Failed to inject security filter: "
                    + (ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
        }
    }

    static Expression buildTenantPredicate(List<Integer> tenantIds) {
        Column column = new Column(TENANT_COLUMN);
        if (tenantIds.size() == 1) {
            return new EqualsTo(column, new LongValue(tenantIds.get(0)));
        }
        List<Expression> values = new ArrayList<>(tenantIds.size());
        for (Integer id : tenantIds) {
            values.add(new LongValue(id));
        }
        return new InExpression(column, new ParenthesedExpressionList<>(values));
    }

    private static Expression parenthesize(Expression expression) {
        return new ParenthesedExpressionList<>(List.of(expression));
    }

    private static SecurityFilterResult fail(String reason) {
        log.error("Failed to inject security filter: {}", reason);
        return SecurityFilterResult.failed("Failed to inject security filter: " + reason);
    }

    /** The plain SELECT under any number of wrapping parentheses, or null. */
    public static PlainSelect plainSelectOf(Statement ast) {
        Select select = ast instanceof Select s ? s : null;
        while (select instanceof ParenthesedSelect parenthesed) {
            select = parenthesed.getSelect();
        }
        return select instanceof PlainSelect plain ? plain : null;
    }
}
