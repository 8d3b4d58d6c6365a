package com.vedant.sqlgateway.controller;

import com.vedant.sqlgateway.dto.AllowedTablesResponseDTO;
import com.vedant.sqlgateway.security.ExplorerPrincipal;
import com.vedant.sqlgateway.security.PrincipalResolver;
import com.vedant.sqlgateway.security.SecurityAuditLogger;
import com.vedant.sqlgateway.service.AllowedTablesCache;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the allow-list snapshot, plus a manual invalidation hook for administrators.
 */
@RestController
@RequestMapping("/api/explorer/admin/allowed-tables")
public class AllowedTablesController {

    private final AllowedTablesCache allowedTablesCache;
    private final PrincipalResolver principalResolver;
    private final SecurityAuditLogger auditLogger;

    public AllowedTablesController(
            AllowedTablesCache allowedTablesCache,
            PrincipalResolver principalResolver,
            SecurityAuditLogger auditLogger
    ) {
        this.allowedTablesCache = allowedTablesCache;
        this.principalResolver = principalResolver;
        this.auditLogger = auditLogger;
    }

    @GetMapping
    public ResponseEntity<AllowedTablesResponseDTO> list(HttpServletRequest request) {
        Optional<ExplorerPrincipal> principal = principalResolver.resolve(request);
        if (principal.isEmpty()) return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        if (!principal.get().canManageAllowList()) return ResponseEntity.status(HttpStatus.FORBIDDEN).build();

        // loads the snapshot if it is missing or expired
        allowedTablesCache.getAllowedTables();
        return allowedTablesCache.snapshotInfo()
                .map(s -> {
                    List<String> names = s.tables().stream()
                            .map(t -> t.schema() == null || t.schema().isBlank() ? t.table() : t.schema() + "." + t.table())
                            .toList();
                    return ResponseEntity.ok(new AllowedTablesResponseDTO(names, names.size(), s.capturedAt()));
                })
                .orElseGet(() -> ResponseEntity.ok(new AllowedTablesResponseDTO(List.of(), 0, null)));
    }

    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(HttpServletRequest request) {
        Optional<ExplorerPrincipal> principal = principalResolver.resolve(request);
        if (principal.isEmpty()) return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        if (!principal.get().canManageAllowList()) return ResponseEntity.status(HttpStatus.FORBIDDEN).build();

        allowedTablesCache.invalidate();
        auditLogger.allowListInvalidated(principal.get());
        return ResponseEntity.ok(Map.of("status", "invalidated"));
    }
}
