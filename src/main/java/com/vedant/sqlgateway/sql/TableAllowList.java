package com.vedant.sqlgateway.sql;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Textual keys for allowed tables and matching of parsed references against them.
 *
 * Each table is registered as {@code schema.table}, {@code table}, {@code "schema"."table"} and
 * {@code "table"}, because the parser keeps identifiers exactly as written. A qualified reference only
 * matches qualified keys; a bare reference only matches bare keys.
 */
public final class TableAllowList {

    private TableAllowList() {}

    public static Set<String> keysFor(String schema, String table) {
        Set<String> keys = new LinkedHashSet<>();
        if (table == null || table.isBlank()) return keys;

        String bare = table.trim();
        keys.add(bare);
        keys.add(quote(bare));
        if (schema != null && !schema.isBlank()) {
            String s = schema.trim();
            keys.add(s + "." + bare);
            keys.add(quote(s) + "." + quote(bare));
        }
        return keys;
    }

    /**
     * @return qualified names of the references that are not allowed, in query order, without duplicates
     */
    public static List<String> findDisallowed(Collection<ParsedTableRef> tables, Set<String> allowedKeys) {
        Set<String> disallowed = new LinkedHashSet<>();
        for (ParsedTableRef ref : tables) {
            if (!isAllowed(ref, allowedKeys)) {
                disallowed.add(ref.qualifiedName());
            }
        }
        return new ArrayList<>(disallowed);
    }

    public static boolean isAllowed(ParsedTableRef ref, Set<String> allowedKeys) {
        if (allowedKeys == null || allowedKeys.isEmpty()) return false;
        return ref.isQualified()
                ? allowedKeys.contains(ref.qualifiedName())
                : allowedKeys.contains(ref.table());
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
