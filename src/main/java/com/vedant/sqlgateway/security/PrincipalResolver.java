package com.vedant.sqlgateway.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the principal that the upstream authentication filter stored on the request.
 * The gateway never builds a principal from client-supplied headers or body fields.
 */
@Component
public class PrincipalResolver {

    public static final String REQUEST_ATTRIBUTE = "explorer.principal";

    public Optional<ExplorerPrincipal> resolve(HttpServletRequest request) {
        Object attribute = request.getAttribute(REQUEST_ATTRIBUTE);
        return attribute instanceof ExplorerPrincipal principal ? Optional.of(principal) : Optional.empty();
    }
}
