package com.vedant.sqlgateway.sql;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.Distinct;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.UnionOp;
import net.sf.jsqlparser.expression.WindowDefinition;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Structural parser for untrusted, generated SQL.
 *
 * Parses the text with JSqlParser and reports everything the gateway needs to decide whether the
 * query may run: statement kind, every table reference (also those inside rejected subqueries, for
 * the audit trail), UNION and subquery usage. Never throws; problems are returned as errors.
 */
@Component
public class SqlAstParser {

    private static final Logger log = LoggerFactory.getLogger(SqlAstParser.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final Pattern SELECT_KEYWORD = Pattern.compile("\\bSELECT\\b", Pattern.CASE_INSENSITIVE);

    private final int maxDepth;

    public SqlAstParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    @Autowired
    public SqlAstParser(@Value("${explorer.parser.max-depth:64}") int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("explorer.parser.max-depth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public ParseResult parse(String sql) {
        Analysis analysis = new Analysis();

        if (sql == null || sql.isBlank()) {
            analysis.error(QueryErrorKind.SQL_PARSE_FAILED, "SQL text is empty");
            return analysis.toResult(null);
        }

        List<Statement> statements;
        try {
            Statements parsed = CCJSqlParserUtil.parseStatements(sql);
            statements = parsed == null ? List.of() : parsed.getStatements();
        } catch (JSQLParserException | RuntimeException ex) {
            String diagnostic = diagnosticOf(ex);
            log.warn("SQL parsing failed: {} (sql preview: {})", diagnostic, preview(sql));
            analysis.error(QueryErrorKind.SQL_PARSE_FAILED, "SQL parse error: " + diagnostic);
            return analysis.toResult(null);
        }

        if (statements == null || statements.isEmpty()) {
            analysis.error(QueryErrorKind.SQL_PARSE_FAILED, "SQL parse error: no statement found");
            return analysis.toResult(null);
        }
        if (statements.size() > 1) {
            analysis.error(QueryErrorKind.MULTI_STATEMENT_REJECTED, "Multiple SQL statements not allowed");
            return analysis.toResult(null);
        }

        Statement statement = statements.get(0);
        if (!(statement instanceof Select select)) {
            analysis.statementKind = statementKindOf(statement);
            analysis.error(QueryErrorKind.NON_SELECT_STATEMENT_REJECTED,
                    "Only SELECT statements are allowed, got: " + analysis.statementKind);
            return analysis.toResult(statement);
        }

        analysis.statementKind = "SELECT";
        analyzeSelect(select, analysis, 0, true);

        if (analysis.errors.isEmpty()) {
            crossCheckTables(statement, analysis);
        }

        ParseResult result = analysis.toResult(statement);
        log.debug("Parsed SQL: valid={}, tables={}, union={}, subquery={}",
                result.isValid(), result.tables().size(), result.hasUnion(), result.hasSubquery());
        return result;
    }

    /* ============================================================
       SELECT structure
       ============================================================ */

    private void analyzeSelect(Select select, Analysis analysis, int depth, boolean topLevel) {
        if (select == null) return;
        if (depth > maxDepth) {
            analysis.tooDeep(maxDepth);
            return;
        }

        List<WithItem> withItems = select.getWithItemsList();
        if (withItems != null && !withItems.isEmpty()) {
            analysis.subquery("Common table expressions (WITH) are not allowed for security reasons");
            for (WithItem withItem : withItems) {
                Select cte = withItem.getSelect();
                analyzeSelect(cte, analysis, depth + 1, false);
            }
        }

        if (select instanceof PlainSelect plain) {
            analyzePlainSelect(plain, analysis, depth);
        } else if (select instanceof SetOperationList setOperations) {
            boolean union = setOperations.getOperations() != null
                    && setOperations.getOperations().stream().anyMatch(op -> op instanceof UnionOp);
            analysis.hasUnion = true;
            analysis.error(QueryErrorKind.UNION_REJECTED, union
                    ? "UNION queries are not allowed for security reasons"
                    : "Set operations (INTERSECT, EXCEPT) are not allowed for security reasons");
            if (setOperations.getSelects() != null) {
                for (Select branch : setOperations.getSelects()) {
                    analyzeSelect(branch, analysis, depth + 1, false);
                }
            }
        } else if (select instanceof ParenthesedSelect parenthesed) {
            // (SELECT ...) on its own is just grouping
            analyzeSelect(parenthesed.getSelect(), analysis, depth + 1, topLevel);
        } else if (topLevel) {
            analysis.statementKind = statementKindOf(select);
            analysis.error(QueryErrorKind.NON_SELECT_STATEMENT_REJECTED,
                    "Only SELECT statements are allowed, got: " + analysis.statementKind);
        } else {
            analysis.error(QueryErrorKind.UNSUPPORTED_CONSTRUCT,
                    "Unsupported query form: " + statementKindOf(select));
        }

        analyzeSelectTail(select, analysis, depth);
    }

    // ORDER BY, LIMIT, OFFSET and FETCH hang off every select form, not just plain ones
    private void analyzeSelectTail(Select select, Analysis analysis, int depth) {
        if (select.getOrderByElements() != null) {
            for (OrderByElement order : select.getOrderByElements()) {
                walk(order.getExpression(), "ORDER BY clause", analysis, depth + 1);
            }
        }

        Limit limit = select.getLimit();
        if (limit != null) {
            walk(limit.getRowCount(), "LIMIT clause", analysis, depth + 1);
            walk(limit.getOffset(), "LIMIT clause", analysis, depth + 1);
        }
        if (select.getOffset() != null) {
            walk(select.getOffset().getOffset(), "OFFSET clause", analysis, depth + 1);
        }
        if (select.getFetch() != null) {
            walk(select.getFetch().getExpression(), "FETCH clause", analysis, depth + 1);
        }
    }

    private void analyzePlainSelect(PlainSelect plain, Analysis analysis, int depth) {
        if (plain.getIntoTables() != null && !plain.getIntoTables().isEmpty()) {
            analysis.error(QueryErrorKind.NON_SELECT_STATEMENT_REJECTED,
                    "SELECT INTO is not allowed; only plain reads are permitted");
        }

        if (plain.getFromItem() != null) {
            analyzeFromItem(plain.getFromItem(), analysis, depth + 1);
        }
        analyzeJoins(plain.getJoins(), analysis, depth + 1);

        Distinct distinct = plain.getDistinct();
        if (distinct != null && distinct.getOnSelectItems() != null) {
            for (SelectItem<?> item : distinct.getOnSelectItems()) {
                walk(item.getExpression(), "DISTINCT ON clause", analysis, depth + 1);
            }
        }

        if (plain.getSelectItems() != null) {
            for (SelectItem<?> item : plain.getSelectItems()) {
                walk(item.getExpression(), "SELECT list", analysis, depth + 1);
            }
        }

        walk(plain.getWhere(), "WHERE clause", analysis, depth + 1);

        if (plain.getGroupBy() != null) {
            screenOpaqueText(plain.getGroupBy().toString(), "GROUP BY clause", analysis);
        }

        walk(plain.getHaving(), "HAVING clause", analysis, depth + 1);

        if (plain.getWindowDefinitions() != null) {
            for (WindowDefinition window : plain.getWindowDefinitions()) {
                screenOpaqueText(window.toString(), "WINDOW clause", analysis);
            }
        }

        walk(plain.getQualify(), "QUALIFY clause", analysis, depth + 1);
    }

    private void analyzeJoins(List<Join> joins, Analysis analysis, int depth) {
        if (joins == null) return;
        for (Join join : joins) {
            analyzeFromItem(join.getRightItem(), analysis, depth);
            if (join.getOnExpressions() != null) {
                for (Expression on : join.getOnExpressions()) {
                    walk(on, "JOIN condition", analysis, depth);
                }
            }
        }
    }

    private void analyzeFromItem(FromItem item, Analysis analysis, int depth) {
        if (item == null) return;
        if (depth > maxDepth) {
            analysis.tooDeep(maxDepth);
            return;
        }

        if (item instanceof Table table) {
            analysis.tables.add(toTableRef(table));
        } else if (item instanceof ParenthesedSelect subquery) {
            analysis.subquery("Subqueries in FROM clause are not allowed for security reasons");
            analyzeSelect(subquery.getSelect(), analysis, depth + 1, false);
        } else if (item instanceof ParenthesedFromItem nested) {
            analyzeFromItem(nested.getFromItem(), analysis, depth + 1);
            analyzeJoins(nested.getJoins(), analysis, depth + 1);
        } else {
            analysis.error(QueryErrorKind.UNSUPPORTED_CONSTRUCT, "Unsupported FROM item: " + item);
        }
    }

    /* ============================================================
       Expression walk
       ============================================================ */

    private void walk(Expression expression, String location, Analysis analysis, int depth) {
        if (expression == null) return;
        if (depth > maxDepth) {
            analysis.tooDeep(maxDepth);
            return;
        }

        SqlNode node = SqlNode.classify(expression);
        List<Expression> children = switch (node.kind()) {
            case BINARY_EXPRESSION, IN_PREDICATE, LIST, CASE, BETWEEN, WRAPPER -> node.operands();
            case FUNCTION -> {
                Function function = (Function) expression;
                screenFunctionName(function.getName(), analysis);
                // FILTER, KEEP and similar parts are not operands
                screenOpaqueText(function.toString(), location, analysis);
                yield node.operands();
            }
            case COLUMN_REFERENCE, LITERAL -> List.of();
            case NESTED_SELECT -> {
                analysis.subquery("Subqueries in " + location + " are not allowed for security reasons");
                analyzeSelect(node.nestedSelect(), analysis, depth + 1, false);
                yield List.of();
            }
            case OPAQUE -> {
                if (expression instanceof AnalyticExpression analytic) {
                    screenFunctionName(analytic.getName(), analysis);
                }
                screenOpaqueText(expression.toString(), location, analysis);
                yield List.of();
            }
        };

        String childLocation = node.kind() == SqlNodeKind.IN_PREDICATE ? "IN clause" : location;
        for (Expression child : children) {
            walk(child, childLocation, analysis, depth + 1);
        }
    }

    // Nodes the walk cannot look inside are rejected if they may hide a nested read
    private void screenOpaqueText(String text, String location, Analysis analysis) {
        if (text != null && SELECT_KEYWORD.matcher(text).find()) {
            analysis.subquery("Subqueries in " + location + " are not allowed for security reasons");
        }
    }

    private void screenFunctionName(String name, Analysis analysis) {
        if (RestrictedFunctions.isRestricted(name)) {
            analysis.error(QueryErrorKind.FUNCTION_NOT_ALLOWED,
                    "Function " + name + " is not allowed in read-only queries");
        }
    }

    private void crossCheckTables(Statement statement, Analysis analysis) {
        try {
            Set<String> found = new TablesNamesFinder().getTables(statement);
            Set<String> known = analysis.tables.stream()
                    .map(ParsedTableRef::qualifiedName)
                    .collect(Collectors.toSet());
            for (String name : found) {
                if (!known.contains(name)) {
                    analysis.error(QueryErrorKind.UNSUPPORTED_CONSTRUCT, "Unrecognized table reference: " + name);
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Table cross-check failed", ex);
            analysis.error(QueryErrorKind.UNSUPPORTED_CONSTRUCT, "Unable to verify table references in query");
        }
    }

    /* ============================================================
       Helpers
       ============================================================ */

    static ParsedTableRef toTableRef(Table table) {
        String name = table.getName();
        String fullName = table.getFullyQualifiedName();
        String schema = null;
        if (fullName != null && name != null
                && fullName.length() > name.length() + 1
                && fullName.endsWith("." + name)) {
            schema = fullName.substring(0, fullName.length() - name.length() - 1);
        }
        String alias = table.getAlias() != null ? table.getAlias().getName() : null;
        return new ParsedTableRef(schema, name, alias);
    }

    // CreateTable -> CREATE TABLE, ExplainStatement -> EXPLAIN
    static String statementKindOf(Object statement) {
        String simpleName = statement.getClass().getSimpleName();
        if (simpleName.endsWith("Statement") && simpleName.length() > "Statement".length()) {
            simpleName = simpleName.substring(0, simpleName.length() - "Statement".length());
        }
        return simpleName.replaceAll("([a-z])([A-Z])", "$1 $2").toUpperCase(Locale.ROOT);
    }

    private static String diagnosticOf(Exception ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = Optional.ofNullable(root.getMessage()).orElse(root.getClass().getSimpleName());
        String firstLine = message.lines().findFirst().orElse(message).trim();
        return firstLine.length() > 300 ? firstLine.substring(0, 300) + "..." : firstLine;
    }

    private static String preview(String sql) {
        return sql.length() > 200 ? sql.substring(0, 200) : sql;
    }

    private static final class Analysis {
        private final Set<String> errors = new LinkedHashSet<>();
        private final Set<QueryErrorKind> errorKinds = EnumSet.noneOf(QueryErrorKind.class);
        private final List<ParsedTableRef> tables = new ArrayList<>();
        private boolean hasUnion;
        private boolean hasSubquery;
        private String statementKind;

        void error(QueryErrorKind kind, String message) {
            errors.add(message);
            errorKinds.add(kind);
        }

        void subquery(String message) {
            hasSubquery = true;
            error(QueryErrorKind.SUBQUERY_REJECTED, message);
        }

        void tooDeep(int maxDepth) {
            error(QueryErrorKind.QUERY_TOO_DEEP, "Query nesting exceeds the maximum supported depth of " + maxDepth);
        }

        ParseResult toResult(Statement ast) {
            return new ParseResult(new ArrayList<>(errors), errorKinds, Optional.ofNullable(ast),
                    tables, hasUnion, hasSubquery, statementKind);
        }
    }
}
