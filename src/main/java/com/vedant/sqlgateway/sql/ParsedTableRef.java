package com.vedant.sqlgateway.sql;

/**
 * A table reference found in a query. Names are kept exactly as written, quotes included.
 *
 * @param schema schema (or database.schema) qualifier, null when the reference is bare
 * @param table  table name
 * @param alias  alias, null when none was given
 */
public record ParsedTableRef(String schema, String table, String alias) {

    public boolean isQualified() {
        return schema != null && !schema.isEmpty();
    }

    public String qualifiedName() {
        return isQualified() ? schema + "." + table : table;
    }
}
