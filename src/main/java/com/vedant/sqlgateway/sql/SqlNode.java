package com.vedant.sqlgateway.sql;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.HexValue;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeKeyExpression;
import net.sf.jsqlparser.expression.TimeValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One classified expression node: its kind plus the child expressions a walk has to visit.
 */
public record SqlNode(SqlNodeKind kind, Expression expression, List<Expression> operands) {

    public static SqlNode classify(Expression expression) {
        // Select must come first: it is an Expression in its own right
        if (expression instanceof Select) {
            return leaf(SqlNodeKind.NESTED_SELECT, expression);
        }
        if (expression instanceof BinaryExpression binary) {
            return of(SqlNodeKind.BINARY_EXPRESSION, expression,
                    binary.getLeftExpression(), binary.getRightExpression());
        }
        if (expression instanceof InExpression in) {
            return of(SqlNodeKind.IN_PREDICATE, expression, in.getLeftExpression(), in.getRightExpression());
        }
        if (expression instanceof Column || expression instanceof AllColumns) {
            return leaf(SqlNodeKind.COLUMN_REFERENCE, expression);
        }
        if (isLiteral(expression)) {
            return leaf(SqlNodeKind.LITERAL, expression);
        }
        if (expression instanceof ExpressionList<?> list) {
            return new SqlNode(SqlNodeKind.LIST, expression, withoutNulls(list));
        }
        if (expression instanceof Function function) {
            List<Expression> params = new ArrayList<>();
            if (function.getParameters() != null) {
                params.addAll(function.getParameters());
            }
            // aggregate ORDER BY, as in string_agg(a, ',' ORDER BY b)
            if (function.getOrderByElements() != null) {
                for (OrderByElement order : function.getOrderByElements()) {
                    params.add(order.getExpression());
                }
            }
            return new SqlNode(SqlNodeKind.FUNCTION, expression, withoutNulls(params));
        }
        if (expression instanceof CaseExpression caseExpr) {
            List<Expression> parts = new ArrayList<>();
            parts.add(caseExpr.getSwitchExpression());
            if (caseExpr.getWhenClauses() != null) {
                for (WhenClause when : caseExpr.getWhenClauses()) {
                    parts.add(when.getWhenExpression());
                    parts.add(when.getThenExpression());
                }
            }
            parts.add(caseExpr.getElseExpression());
            return new SqlNode(SqlNodeKind.CASE, expression, withoutNulls(parts));
        }
        if (expression instanceof Between between) {
            return of(SqlNodeKind.BETWEEN, expression, between.getLeftExpression(),
                    between.getBetweenExpressionStart(), between.getBetweenExpressionEnd());
        }
        if (expression instanceof NotExpression not) {
            return of(SqlNodeKind.WRAPPER, expression, not.getExpression());
        }
        if (expression instanceof ExistsExpression exists) {
            return of(SqlNodeKind.WRAPPER, expression, exists.getRightExpression());
        }
        if (expression instanceof IsNullExpression isNull) {
            return of(SqlNodeKind.WRAPPER, expression, isNull.getLeftExpression());
        }
        if (expression instanceof SignedExpression signed) {
            return of(SqlNodeKind.WRAPPER, expression, signed.getExpression());
        }
        if (expression instanceof CastExpression cast) {
            return of(SqlNodeKind.WRAPPER, expression, cast.getLeftExpression());
        }
        return leaf(SqlNodeKind.OPAQUE, expression);
    }

    public Select nestedSelect() {
        return kind == SqlNodeKind.NESTED_SELECT ? (Select) expression : null;
    }

    private static boolean isLiteral(Expression e) {
        return e instanceof LongValue
                || e instanceof DoubleValue
                || e instanceof StringValue
                || e instanceof NullValue
                || e instanceof DateValue
                || e instanceof TimeValue
                || e instanceof TimestampValue
                || e instanceof HexValue
                || e instanceof TimeKeyExpression
                || e instanceof JdbcParameter;
    }

    private static SqlNode leaf(SqlNodeKind kind, Expression expression) {
        return new SqlNode(kind, expression, Collections.emptyList());
    }

    private static SqlNode of(SqlNodeKind kind, Expression expression, Expression... operands) {
        List<Expression> list = new ArrayList<>(operands.length);
        Collections.addAll(list, operands);
        return new SqlNode(kind, expression, withoutNulls(list));
    }

    private static List<Expression> withoutNulls(List<? extends Expression> in) {
        List<Expression> out = new ArrayList<>(in.size());
        for (Expression e : in) {
            if (e != null) out.add(e);
        }
        return out;
    }
}
