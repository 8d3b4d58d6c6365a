package com.vedant.sqlgateway.controller;

import com.vedant.sqlgateway.dto.QueryRequestDTO;
import com.vedant.sqlgateway.dto.QueryResponseDTO;
import com.vedant.sqlgateway.dto.ValidationResponseDTO;
import com.vedant.sqlgateway.entity.QueryHistory;
import com.vedant.sqlgateway.exception.QueryErrorKind;
import com.vedant.sqlgateway.exception.QueryExecutionException;
import com.vedant.sqlgateway.exception.QueryRejectedException;
import com.vedant.sqlgateway.repository.QueryHistoryRepository;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.security.PrincipalResolver;
import com.vedant.sqlgateway.service.ExecuteOptions;
import com.vedant.sqlgateway.service.ExecuteResult;
import com.vedant.sqlgateway.service.QueryExecutorService;
import com.vedant.sqlgateway.service.QuerySecurityService;
import com.vedant.sqlgateway.service.QueryValidation;
import com.vedant.sqlgateway.sql.ParsedTableRef;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/explorer/query")
public class QueryController {

    private final QuerySecurityService securityService;
    private final QueryExecutorService executorService;
    private final QueryHistoryRepository historyRepository;
    private final PrincipalResolver principalResolver;

    public QueryController(
            QuerySecurityService securityService,
            QueryExecutorService executorService,
            QueryHistoryRepository historyRepository,
            PrincipalResolver principalResolver
    ) {
        this.securityService = securityService;
        this.executorService = executorService;
        this.historyRepository = historyRepository;
        this.principalResolver = principalResolver;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponseDTO> validate(@RequestBody QueryRequestDTO req, HttpServletRequest request) {
        if (principalResolver.resolve(request).isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        QueryValidation validation = securityService.validate(req.getSql());

        ValidationResponseDTO dto = new ValidationResponseDTO();
        dto.setValid(validation.isValid());
        dto.setErrors(validation.errors());
        dto.setErrorKinds(validation.errorKinds().stream().map(Enum::name).sorted().toList());
        dto.setWarnings(validation.warnings());
        dto.setTables(validation.tables().stream().map(ParsedTableRef::qualifiedName).distinct().toList());
        dto.setRequiresTenantFilter(validation.requiresTenantFilter());
        return ResponseEntity.ok(dto);
    }

    @PostMapping("/execute")
    public ResponseEntity<QueryResponseDTO> execute(@RequestBody QueryRequestDTO req, HttpServletRequest request) {
        Optional<ExplorerPrincipal> principal = principalResolver.resolve(request);
        if (principal.isEmpty()) {
            QueryResponseDTO dto = new QueryResponseDTO();
            dto.setMessage("Authentication required");
            dto.setErrorKind(QueryErrorKind.MISSING_PRINCIPAL.name());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(dto);
        }

        try {
            ExecuteResult result = executorService.execute(
                    req.getSql(), principal.get(), new ExecuteOptions(req.getRowLimit(), req.getTimeoutMs()));
            QueryResponseDTO dto = new QueryResponseDTO();
            dto.setSql(result.executedSql());
            dto.setRows(result.rows());
            dto.setColumns(result.columns());
            dto.setRowCount(result.rowCount());
            dto.setExecutionTimeMs(result.executionTimeMs());
            dto.setMessage("OK");
            return ResponseEntity.ok(dto);
        } catch (QueryRejectedException ex) {
            QueryResponseDTO dto = new QueryResponseDTO();
            dto.setMessage(ex.getMessage());
            dto.setErrors(ex.getErrors());
            dto.setErrorKind(ex.getErrorKinds().stream().map(Enum::name).sorted().findFirst().orElse(null));
            return ResponseEntity.badRequest().body(dto);
        } catch (QueryExecutionException ex) {
            QueryResponseDTO dto = new QueryResponseDTO();
            dto.setMessage(ex.getMessage());
            dto.setErrorKind(ex.getKind().name());
            return ResponseEntity.status(statusFor(ex.getKind())).body(dto);
        }
    }

    @GetMapping("/history")
    public ResponseEntity<List<QueryHistory>> getHistory(HttpServletRequest request) {
        Optional<ExplorerPrincipal> principal = principalResolver.resolve(request);
        if (principal.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(historyRepository.findTop50ByUserIdOrderByExecutedAtDesc(principal.get().userId()));
    }

    private static HttpStatus statusFor(QueryErrorKind kind) {
        return switch (kind) {
            case ENGINE_UNREACHABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case QUERY_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
