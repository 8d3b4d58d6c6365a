package com.vedant.sqlgateway.exception;

/**
 * Every reason a submitted query can be refused or fail.
 * Validation-stage kinds travel as data; execution-stage kinds are thrown.
 */
public enum QueryErrorKind {

    // validation stage
    MULTI_STATEMENT_REJECTED,
    NON_SELECT_STATEMENT_REJECTED,
    DESTRUCTIVE_KEYWORD_DETECTED,
    UNION_REJECTED,
    SUBQUERY_REJECTED,
    TABLE_NOT_ALLOWED,
    EMPTY_TENANT_SCOPE,
    SQL_PARSE_FAILED,
    NO_TABLE_REFERENCED,
    QUERY_TOO_DEEP,
    UNSUPPORTED_CONSTRUCT,
    FUNCTION_NOT_ALLOWED,
    MISSING_PRINCIPAL,
    FILTER_INJECTION_FAILED,

    // execution stage
    ENGINE_UNREACHABLE,
    QUERY_TIMEOUT,
    EXECUTION_FAILED
}
