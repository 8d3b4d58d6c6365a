package com.vedant.sqlgateway.controller;

import com.vedant.sqlgateway.entity.QueryHistory;
import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.exception.QueryExecutionException;
import com.vedant.sqlgateway.exception.QueryRejectedException;
import com.vedant.sqlgateway.repository.QueryHistoryRepository;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.security.PrincipalResolver;
import com.vedant.sqlgateway.service.ColumnInfo;
import com.vedant.sqlgateway.service.ExecuteOptions;
import com.vedant.sqlgateway.service.ExecuteResult;
import com.vedant.sqlgateway.service.QueryExecutorService;
import com.vedant.sqlgateway.service.QuerySecurityService;
import com.vedant.sqlgateway.service.QueryValidation;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class QueryControllerTest {

    private static final String BODY = "{\"sql\":\"SELECT a FROM ih.x\",\"rowLimit\":20}";

    private QuerySecurityService securityService;
    private QueryExecutorService executorService;
    private QueryHistoryRepository historyRepository;
    private MockMvc mvc;

    private final ExplorerPrincipal principal =
            new ExplorerPrincipal("user-1", "user@example.com", false, Set.of(), List.of(7));

    @BeforeEach
    void setUp() {
        securityService = mock(QuerySecurityService.class);
        executorService = mock(QueryExecutorService.class);
        historyRepository = mock(QueryHistoryRepository.class);
        mvc = MockMvcBuilders.standaloneSetup(
                new QueryController(securityService, executorService, historyRepository, new PrincipalResolver())
        ).build();
    }

    @Test
    void requestWithoutPrincipalIsUnauthorized() throws Exception {
        mvc.perform(post("/api/explorer/query/execute").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(executorService);
    }

    @Test
    void validateReturnsVerdict() throws Exception {
        when(securityService.validate("SELECT a FROM ih.x")).thenReturn(new QueryValidation(
                true, List.of(), Set.of(), List.of("Query has no LIMIT; the default row limit will be applied"),
                List.of(new ParsedTableRef("ih", "x", null)), true));

        mvc.perform(post("/api/explorer/query/validate")
                        .requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal)
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.tables[0]").value("ih.x"))
                .andExpect(jsonPath("$.requiresTenantFilter").value(true));
    }

    @Test
    void executeReturnsRowsAndColumns() throws Exception {
        when(executorService.execute(eq("SELECT a FROM ih.x"), eq(principal), any(ExecuteOptions.class)))
                .thenReturn(new ExecuteResult(List.of(Map.of("a", 1)), 1, 12L,
                        List.of(new ColumnInfo("a", "number")), "SELECT a FROM ih.x WHERE practice_uid = 7 LIMIT 20"));

        mvc.perform(post("/api/explorer/query/execute")
                        .requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal)
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.columns[0].type").value("number"))
                .andExpect(jsonPath("$.sql").value("SELECT a FROM ih.x WHERE practice_uid = 7 LIMIT 20"));

        verify(executorService).execute("SELECT a FROM ih.x", principal, new ExecuteOptions(20, null));
    }

    @Test
    void rejectionMapsToBadRequestWithAllErrors() throws Exception {
        when(executorService.execute(anyString(), any(), any())).thenThrow(new QueryRejectedException(
                List.of("Tables not in allow-list: public.users"), EnumSet.of(QueryErrorKind.TABLE_NOT_ALLOWED)));

        mvc.perform(post("/api/explorer/query/execute")
                        .requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal)
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("Tables not in allow-list: public.users"))
                .andExpect(jsonPath("$.errorKind").value("TABLE_NOT_ALLOWED"));
    }

    @Test
    void timeoutMapsToGatewayTimeout() throws Exception {
        when(executorService.execute(anyString(), any(), any())).thenThrow(
                new QueryExecutionException(QueryErrorKind.QUERY_TIMEOUT, "Query exceeded the time limit of 100 ms"));

        mvc.perform(post("/api/explorer/query/execute")
                        .requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal)
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errorKind").value("QUERY_TIMEOUT"));
    }

    @Test
    void unreachableEngineMapsToServiceUnavailable() throws Exception {
        when(executorService.execute(anyString(), any(), any())).thenThrow(
                new QueryExecutionException(QueryErrorKind.ENGINE_UNREACHABLE, "Analytics database is unavailable"));

        mvc.perform(post("/api/explorer/query/execute")
                        .requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal)
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void historyIsScopedToCaller() throws Exception {
        QueryHistory entry = new QueryHistory();
        entry.setUserId("user-1");
        entry.setStatus(QueryHistory.Status.SUCCESS);
        when(historyRepository.findTop50ByUserIdOrderByExecutedAtDesc("user-1")).thenReturn(List.of(entry));

        mvc.perform(get("/api/explorer/query/history").requestAttr(PrincipalResolver.REQUEST_ATTRIBUTE, principal))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("SUCCESS"));
    }
}
