package com.vedant.sqlgateway.security;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Security-relevant events of the query pathway. Written to the dedicated {@code SECURITY} logger,
 * which logback-spring.xml routes to its own appender.
 */
@Component
public class SecurityAuditLogger {

    public static final String LOGGER_NAME = "SECURITY";
    public static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    public void tenantFilterBypassed(ExplorerPrincipal principal, List<ParsedTableRef> tables) {
        String reason = principal.superAdmin() ? "super_admin" : ExplorerPrincipal.UNRESTRICTED_EXECUTE;
        audit.warn(SECURITY, "event=tenant_filter_bypassed userId={} reason={} tables={}",
                principal.userId(), reason, names(tables));
    }

    public void emptyTenantScope(ExplorerPrincipal principal, List<ParsedTableRef> tables) {
        audit.warn(SECURITY, "event=empty_tenant_scope userId={} tables={}", principal.userId(), names(tables));
    }

    public void queryRejected(String userId, Collection<QueryErrorKind> kinds, List<String> errors) {
        audit.warn(SECURITY, "event=query_rejected userId={} kinds={} errors={}", userId, kinds, errors);
    }

    public void tenantFilterApplied(ExplorerPrincipal principal, int tenantCount) {
        audit.info(SECURITY, "event=tenant_filter_applied userId={} tenants={}", principal.userId(), tenantCount);
    }

    public void allowListInvalidated(ExplorerPrincipal principal) {
        audit.info(SECURITY, "event=allow_list_invalidated userId={}", principal.userId());
    }

    private static String names(List<ParsedTableRef> tables) {
        return tables.stream().map(ParsedTableRef::qualifiedName).collect(Collectors.joining(","));
    }
}
