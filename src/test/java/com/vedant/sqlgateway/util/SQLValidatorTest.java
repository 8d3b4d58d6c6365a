package com.vedant.sqlgateway.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SQLValidatorTest {

    @Test
    void plainSelectHasNoDestructiveKeywords() {
        assertTrue(SQLValidator.scanForDestructiveKeywords("SELECT a, b FROM ih.patients WHERE a > 1").isEmpty());
    }

    @Test
    void reportsKeywordsInFixedOrderRegardlessOfPosition() {
        List<String> found = SQLValidator.scanForDestructiveKeywords(
                "update t set a = 1; delete from t; drop table t");
        assertEquals(List.of("DROP", "DELETE", "UPDATE"), found);
    }

    @Test
    void matchesWholeWordsOnly() {
        // created_at / updated_by / dropoff are column names, not statements
        assertTrue(SQLValidator.scanForDestructiveKeywords(
                "SELECT created_at, updated_by, dropoff FROM ih.visits").isEmpty());
    }

    @Test
    void literalsAreNotExempt() {
        assertEquals(List.of("DROP"),
                SQLValidator.scanForDestructiveKeywords("SELECT a FROM t WHERE note = 'please drop me'"));
    }

    @Test
    void nullOrBlankInputYieldsEmptyList() {
        assertTrue(SQLValidator.scanForDestructiveKeywords(null).isEmpty());
        assertTrue(SQLValidator.scanForDestructiveKeywords("   ").isEmpty());
    }
}
