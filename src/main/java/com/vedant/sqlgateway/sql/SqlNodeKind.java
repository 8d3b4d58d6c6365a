package com.vedant.sqlgateway.sql;

/**
 * Kinds of expression nodes the analyzer distinguishes.
 * Consumers switch over this exhaustively (switch expressions, no default),
 * so a new constant fails compilation at every walk site until it is handled.
 */
public enum SqlNodeKind {
    BINARY_EXPRESSION,
    IN_PREDICATE,
    COLUMN_REFERENCE,
    LITERAL,
    LIST,
    NESTED_SELECT,
    FUNCTION,
    CASE,
    BETWEEN,
    WRAPPER,
    OPAQUE
}
