package com.vedant.sqlgateway.service;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.security.SecurityAuditLogger;
import com.vedant.sqlgateway.sql.ParseResult;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import com.vedant.sqlgateway.sql.SecurityFilterResult;
import com.vedant.sqlgateway.sql.SqlAstParser;
import com.vedant.sqlgateway.sql.TableAllowList;
import com.vedant.sqlgateway.sql.TenantFilterInjector;
import com.vedant.sqlgateway.util.SQLValidator;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a generated query may run and, if so, in which form.
 *
 * Checks always run in the same order: destructive keyword screen, structural parse, table
 * allow-list, then tenant scoping. The first failing stage ends the pipeline.
 */
@Service
public class QuerySecurityService {

    private static final Logger log = LoggerFactory.getLogger(QuerySecurityService.class);

    static final String SELECT_STAR_WARNING = "SELECT * returns every column; list only the columns you need";
    static final String MISSING_LIMIT_WARNING = "Query has no LIMIT; the default row limit will be applied";

    private final SqlAstParser parser;
    private final AllowedTablesCache allowedTablesCache;
    private final TenantFilterInjector tenantFilterInjector;
    private final SecurityAuditLogger auditLogger;

    public QuerySecurityService(
            SqlAstParser parser,
            AllowedTablesCache allowedTablesCache,
            TenantFilterInjector tenantFilterInjector,
            SecurityAuditLogger auditLogger
    ) {
        this.parser = parser;
        this.allowedTablesCache = allowedTablesCache;
        this.tenantFilterInjector = tenantFilterInjector;
        this.auditLogger = auditLogger;
    }

    public QueryValidation validate(String sql) {
        Screening screening = screen(sql);
        if (!screening.passed()) {
            auditLogger.queryRejected(null, screening.errorKinds(), screening.errors());
        }
        return new QueryValidation(
                screening.passed(),
                screening.errors(),
                screening.errorKinds(),
                screening.warnings(),
                screening.tables(),
                screening.passed()
        );
    }

    public SecuredQuery secure(String sql, ExplorerPrincipal principal) {
        String userId = principal == null ? null : principal.userId();

        Screening screening = screen(sql);
        if (!screening.passed()) {
            return reject(userId, screening.errors(), screening.errorKinds(), screening.tables());
        }
        List<ParsedTableRef> tables = screening.tables();

        if (principal == null) {
            return reject(null, List.of("No authenticated principal for query execution"),
                    EnumSet.of(QueryErrorKind.MISSING_PRINCIPAL), tables);
        }

        if (principal.bypassesTenantFilter()) {
            auditLogger.tenantFilterBypassed(principal, tables);
            return SecuredQuery.accepted(sql, tables, true);
        }

        if (principal.practiceUids().isEmpty()) {
            auditLogger.emptyTenantScope(principal, tables);
            return reject(userId, List.of("No practice access configured for this user; query cannot be scoped"),
                    EnumSet.of(QueryErrorKind.EMPTY_TENANT_SCOPE), tables);
        }

        Statement ast = screening.parsed().ast().orElse(null);
        SecurityFilterResult filtered = tenantFilterInjector.injectTenantFilter(ast, principal.practiceUids());
        if (!filtered.success()) {
            return reject(userId, List.of(filtered.error()),
                    EnumSet.of(QueryErrorKind.FILTER_INJECTION_FAILED), tables);
        }

        auditLogger.tenantFilterApplied(principal, principal.practiceUids().size());
        log.debug("Secured query for user {} over {} table(s)", userId, tables.size());
        return SecuredQuery.accepted(filtered.sql(), tables, false);
    }

    private SecuredQuery reject(String userId, List<String> errors, Set<QueryErrorKind> kinds,
                                List<ParsedTableRef> tables) {
        auditLogger.queryRejected(userId, kinds, errors);
        return SecuredQuery.rejected(errors, kinds, tables);
    }

    private Screening screen(String sql) {
        List<String> destructive = SQLValidator.scanForDestructiveKeywords(sql);
        if (!destructive.isEmpty()) {
            return Screening.failed("Destructive operations not allowed: " + String.join(", ", destructive),
                    QueryErrorKind.DESTRUCTIVE_KEYWORD_DETECTED, List.of(), null);
        }

        ParseResult parsed = parser.parse(sql);
        if (!parsed.isValid()) {
            return new Screening(parsed.errors(), parsed.errorKinds(), List.of(), parsed.tables(), parsed);
        }

        if (parsed.tables().isEmpty()) {
            return Screening.failed("Query must reference at least one table",
                    QueryErrorKind.NO_TABLE_REFERENCED, parsed.tables(), parsed);
        }

        List<String> disallowed = TableAllowList.findDisallowed(parsed.tables(), allowedTablesCache.getAllowedTables());
        if (!disallowed.isEmpty()) {
            return Screening.failed("Tables not in allow-list: " + String.join(", ", disallowed),
                    QueryErrorKind.TABLE_NOT_ALLOWED, parsed.tables(), parsed);
        }

        return new Screening(List.of(), Set.of(), warningsFor(parsed), parsed.tables(), parsed);
    }

    private static List<String> warningsFor(ParseResult parsed) {
        List<String> warnings = new ArrayList<>();
        PlainSelect plain = TenantFilterInjector.plainSelectOf(parsed.ast().orElse(null));
        if (plain == null) return warnings;

        if (plain.getSelectItems() != null
                && plain.getSelectItems().stream().anyMatch(item -> item.getExpression() instanceof AllColumns)) {
            warnings.add(SELECT_STAR_WARNING);
        }
        if (plain.getLimit() == null && plain.getFetch() == null) {
            warnings.add(MISSING_LIMIT_WARNING);
        }
        return warnings;
    }

    private record Screening(
            List<String> errors,
            Set<QueryErrorKind> errorKinds,
            List<String> warnings,
            List<ParsedTableRef> tables,
            ParseResult parsed
    ) {
        boolean passed() {
            return errors.isEmpty();
        }

        static Screening failed(String error, QueryErrorKind kind, List<ParsedTableRef> tables, ParseResult parsed) {
            return new Screening(List.of(error), EnumSet.of(kind), List.of(), tables, parsed);
        }
    }
}
