package com.vedant.sqlgateway.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Functions a generated read must never call: they run SQL given as text, reach other databases,
 * touch files or change server state.
 */
public final class RestrictedFunctions {

    private static final Set<String> NAMES = Set.of(
            "nextval", "setval", "set_config",
            "pg_notify", "pg_reload_conf", "pg_rotate_logfile", "pg_switch_wal",
            "pg_create_restore_point", "pg_stat_file", "ts_stat", "txid_current"
    );

    // query_to_xml, query_to_xmlschema, query_to_xml_and_xmlschema and friends
    private static final List<String> PREFIXES = List.of(
            "query_to_xml", "cursor_to_xml", "table_to_xml", "schema_to_xml", "database_to_xml",
            "dblink", "lo_", "pg_read_", "pg_ls_", "pg_sleep", "pg_advisory_",
            "pg_terminate_", "pg_cancel_", "pg_logical_", "pg_replication_", "pg_file_"
    );

    private RestrictedFunctions() {}

    /** True when {@code name}, optionally schema-qualified or quoted, is a restricted function. */
    public static boolean isRestricted(String name) {
        if (name == null || name.isBlank()) return false;
        String bare = name.substring(name.lastIndexOf('.') + 1)
                .replace("\"", "")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (NAMES.contains(bare)) return true;
        for (String prefix : PREFIXES) {
            if (bare.startsWith(prefix)) return true;
        }
        return false;
    }
}
