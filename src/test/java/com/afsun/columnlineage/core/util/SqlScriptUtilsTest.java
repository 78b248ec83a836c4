package com.afsun.columnlineage.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScriptUtilsTest {

    @Test
    void testStripLineAndBlockComments() {
        String sql = "-- header\nSELECT a, /* inline */ b FROM t -- tail\n";
        String cleaned = SqlScriptUtils.stripComments(sql, false);
        assertFalse(cleaned.contains("header"));
        assertFalse(cleaned.contains("inline"));
        assertFalse(cleaned.contains("tail"));
        assertTrue(cleaned.startsWith("SELECT a,"));
    }

    @Test
    void testCommentMarkersInsideStringsAreKept() {
        String sql = "SELECT '-- not a comment', '/* nor this */' FROM t";
        assertEquals(sql, SqlScriptUtils.stripComments(sql, false));
    }

    @Test
    void testHashCommentOnlyWhenEnabled() {
        String sql = "SELECT a FROM t # mysql comment";
        assertEquals("SELECT a FROM t", SqlScriptUtils.stripComments(sql, true));
        assertEquals(sql, SqlScriptUtils.stripComments(sql, false));
    }

    @Test
    void testSplitStatementsIgnoresQuotedSemicolons() {
        List<String> parts = SqlScriptUtils.splitStatements("SELECT 'a;b' FROM t; ; SELECT 2;");
        assertEquals(2, parts.size());
        assertEquals("SELECT 'a;b' FROM t", parts.get(0));
        assertEquals("SELECT 2", parts.get(1));
    }

    @Test
    void testSplitHandlesEscapedQuotes() {
        List<String> parts = SqlScriptUtils.splitStatements("SELECT 'it''s;ok' FROM t; SELECT 1");
        assertEquals(2, parts.size());
        assertEquals("SELECT 'it''s;ok' FROM t", parts.get(0));
    }

    @Test
    void testPreviewCollapsesWhitespaceAndTruncates() {
        assertEquals("SELECT a FROM t", SqlScriptUtils.preview("SELECT   a\n\tFROM t"));

        StringBuilder longSql = new StringBuilder("SELECT ");
        for (int i = 0; i < 50; i++) {
            longSql.append("col_").append(i).append(", ");
        }
        String preview = SqlScriptUtils.preview(longSql.toString());
        assertEquals(103, preview.length());
        assertTrue(preview.endsWith("..."));
    }
}
