package com.vedant.sqlgateway.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The authenticated caller as handed over by the upstream authentication layer.
 *
 * @param practiceUids tenant ids this caller may see, in the order they were resolved
 */
public record ExplorerPrincipal(
        String userId,
        String email,
        boolean superAdmin,
        Set<String> permissions,
        List<Integer> practiceUids
) {

    public static final String UNRESTRICTED_EXECUTE = "data-explorer:execute:all";
    public static final String MANAGE_METADATA = "data-explorer:metadata:manage:all";

    public ExplorerPrincipal {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        // null entries are kept as-is; the injector rejects them
        practiceUids = practiceUids == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(practiceUids));
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public boolean bypassesTenantFilter() {
        return superAdmin || hasPermission(UNRESTRICTED_EXECUTE);
    }

    public boolean canManageAllowList() {
        return superAdmin || hasPermission(MANAGE_METADATA);
    }
}
