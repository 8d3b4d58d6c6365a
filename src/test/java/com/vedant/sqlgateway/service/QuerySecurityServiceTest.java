package com.vedant.sqlgateway.service;

import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.security.SecurityAuditLogger;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import com.vedant.sqlgateway.sql.SqlAstParser;
import com.vedant.sqlgateway.sql.TableAllowList;
import com.vedant.sqlgateway.sql.TenantFilterInjector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class QuerySecurityServiceTest {

    private static final String SCENARIO_A = "SELECT measure FROM ih.encounters WHERE year = 2024";

    private AllowedTablesCache cache;
    private SecurityAuditLogger audit;
    private QuerySecurityService service;

    @BeforeEach
    void setUp() {
        cache = mock(AllowedTablesCache.class);
        audit = mock(SecurityAuditLogger.class);
        Set<String> allowed = new HashSet<>();
        allowed.addAll(TableAllowList.keysFor("ih", "encounters"));
        allowed.addAll(TableAllowList.keysFor("ih", "patients"));
        allowed.addAll(TableAllowList.keysFor("ih", "claims"));
        when(cache.getAllowedTables()).thenReturn(allowed);

        service = new QuerySecurityService(new SqlAstParser(), cache, new TenantFilterInjector(), audit);
    }

    private static ExplorerPrincipal tenantUser(Integer... practices) {
        return new ExplorerPrincipal("user-1", "user@example.com", false, Set.of(), List.of(practices));
    }

    @Test
    void scenarioA_tenantFilterIsAppendedToExistingWhere() {
        SecuredQuery secured = service.secure(SCENARIO_A, tenantUser(10, 20));

        assertTrue(secured.success(), () -> "unexpected errors: " + secured.errors());
        assertEquals("SELECT measure FROM ih.encounters WHERE (year = 2024) AND (practice_uid IN (10, 20))",
                secured.sql());
        assertFalse(secured.tenantFilterBypassed());
        verify(audit).tenantFilterApplied(any(ExplorerPrincipal.class), eq(2));
    }

    @Test
    void scenarioB_destructiveKeywordRejectedBeforeParsing() {
        SecuredQuery secured = service.secure("DROP TABLE x; SELECT 1", tenantUser(10));

        assertFalse(secured.success());
        assertEquals("", secured.sql());
        assertEquals(List.of("Destructive operations not allowed: DROP"), secured.errors());
        assertEquals(Set.of(QueryErrorKind.DESTRUCTIVE_KEYWORD_DETECTED), secured.errorKinds());
        verify(cache, never()).getAllowedTables();
        verify(audit).queryRejected(eq("user-1"), anyCollection(), anyList());
    }

    @Test
    void scenarioC_subqueryRejectedButBothTablesReported() {
        SecuredQuery secured = service.secure(
                "SELECT * FROM ih.patients WHERE id IN (SELECT patient_id FROM ih.claims)", tenantUser(10));

        assertFalse(secured.success());
        assertTrue(secured.errorKinds().contains(QueryErrorKind.SUBQUERY_REJECTED));
        List<String> tables = secured.tables().stream().map(ParsedTableRef::qualifiedName).toList();
        assertTrue(tables.containsAll(List.of("ih.patients", "ih.claims")));
    }

    @Test
    void scenarioD_tableOutsideAllowListIsNamed() {
        SecuredQuery secured = service.secure("SELECT name FROM public.users", tenantUser(10));

        assertFalse(secured.success());
        assertEquals(List.of("Tables not in allow-list: public.users"), secured.errors());
        assertEquals(Set.of(QueryErrorKind.TABLE_NOT_ALLOWED), secured.errorKinds());
    }

    @Test
    void scenarioE_privilegedPrincipalGetsOriginalSqlAndBypassIsAudited() {
        ExplorerPrincipal admin = new ExplorerPrincipal("admin-1", null, true, Set.of(), List.of());

        SecuredQuery secured = service.secure(SCENARIO_A, admin);

        assertTrue(secured.success());
        assertEquals(SCENARIO_A, secured.sql());
        assertTrue(secured.tenantFilterBypassed());
        verify(audit).tenantFilterBypassed(eq(admin), anyList());
    }

    @Test
    void unrestrictedPermissionAlsoBypasses() {
        ExplorerPrincipal analyst = new ExplorerPrincipal("analyst-1", null, false,
                Set.of(ExplorerPrincipal.UNRESTRICTED_EXECUTE), List.of(5));

        SecuredQuery secured = service.secure(SCENARIO_A, analyst);

        assertTrue(secured.tenantFilterBypassed());
        assertEquals(SCENARIO_A, secured.sql());
    }

    @Test
    void scenarioF_emptyTenantScopeIsHardFailure() {
        SecuredQuery secured = service.secure(SCENARIO_A, tenantUser());

        assertFalse(secured.success());
        assertEquals("", secured.sql());
        assertEquals(Set.of(QueryErrorKind.EMPTY_TENANT_SCOPE), secured.errorKinds());
        verify(audit).emptyTenantScope(any(ExplorerPrincipal.class), anyList());
    }

    @Test
    void missingPrincipalIsRejected() {
        SecuredQuery secured = service.secure(SCENARIO_A, null);

        assertFalse(secured.success());
        assertEquals(Set.of(QueryErrorKind.MISSING_PRINCIPAL), secured.errorKinds());
    }

    @Test
    void nullTenantIdFailsInjectionInsteadOfRunningUnfiltered() {
        ExplorerPrincipal broken = new ExplorerPrincipal("user-2", null, false, Set.of(),
                java.util.Arrays.asList(1, null));

        SecuredQuery secured = service.secure(SCENARIO_A, broken);

        assertFalse(secured.success());
        assertEquals("", secured.sql());
        assertEquals(Set.of(QueryErrorKind.FILTER_INJECTION_FAILED), secured.errorKinds());
    }

    @Test
    void queryWithoutTablesIsRejected() {
        QueryValidation validation = service.validate("SELECT 1");

        assertFalse(validation.isValid());
        assertEquals(List.of("Query must reference at least one table"), validation.errors());
    }

    @Test
    void validationWarnsAboutSelectStarAndMissingLimit() {
        QueryValidation validation = service.validate("SELECT * FROM ih.patients");

        assertTrue(validation.isValid());
        assertTrue(validation.requiresTenantFilter());
        assertEquals(List.of(QuerySecurityService.SELECT_STAR_WARNING, QuerySecurityService.MISSING_LIMIT_WARNING),
                validation.warnings());
    }

    @Test
    void validationOfBoundedExplicitQueryHasNoWarnings() {
        QueryValidation validation = service.validate("SELECT id, name FROM ih.patients LIMIT 10");

        assertTrue(validation.isValid());
        assertTrue(validation.warnings().isEmpty());
    }

    @Test
    void qualifiedReferenceDoesNotMatchBareKeyOfOtherSchema() {
        when(cache.getAllowedTables()).thenReturn(Set.of("users", "\"users\""));

        QueryValidation validation = service.validate("SELECT id FROM public.users");

        assertFalse(validation.isValid());
        assertEquals(List.of("Tables not in allow-list: public.users"), validation.errors());
    }

    @Test
    void subqueryHiddenInOffsetIsNotScopedAndRun() {
        SecuredQuery secured = service.secure(
                "SELECT a FROM ih.encounters OFFSET (SELECT count(*) FROM public.users)", tenantUser(10));

        assertFalse(secured.success());
        assertTrue(secured.errorKinds().contains(QueryErrorKind.SUBQUERY_REJECTED));
        List<String> tables = secured.tables().stream().map(ParsedTableRef::qualifiedName).toList();
        assertTrue(tables.contains("public.users"), () -> "tables were: " + tables);
    }

    @Test
    void subqueryHiddenInAggregateOrderByIsNotScopedAndRun() {
        SecuredQuery secured = service.secure(
                "SELECT string_agg(a, ',' ORDER BY (SELECT max(ssn) FROM public.users)) FROM ih.encounters",
                tenantUser(10));

        assertFalse(secured.success());
        assertTrue(secured.errorKinds().contains(QueryErrorKind.SUBQUERY_REJECTED));
        verify(audit, never()).tenantFilterApplied(any(ExplorerPrincipal.class), anyInt());
    }

    @Test
    void sqlRunningFunctionIsRejected() {
        QueryValidation validation = service.validate(
                "SELECT query_to_xml('select * from public.users', true, false, '') FROM ih.encounters");

        assertFalse(validation.isValid());
        assertTrue(validation.errorKinds().contains(QueryErrorKind.FUNCTION_NOT_ALLOWED));
    }
}
