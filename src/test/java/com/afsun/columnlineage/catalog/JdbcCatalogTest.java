package com.afsun.columnlineage.catalog;

import com.afsun.columnlineage.core.exceptions.CatalogException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.SQLException;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class JdbcCatalogTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcCatalog catalog;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        catalog = new JdbcCatalog(jdbcTemplate);
    }

    @Test
    void testReturnsDdlFromShowCreateTable() {
        when(jdbcTemplate.query(eq("SHOW CREATE TABLE ods.orders"), ArgumentMatchers.<RowMapper<String>>any()))
                .thenReturn(Collections.singletonList("CREATE TABLE orders (id INT)"));

        assertEquals("CREATE TABLE orders (id INT)", catalog.getDdl("ods.orders"));
    }

    @Test
    void testCustomQueryTemplate() {
        catalog.configure(Collections.singletonMap(JdbcCatalog.DDL_QUERY_KEY, "SHOW CREATE TABLE {table} FORMAT TSVRaw"));
        when(jdbcTemplate.query(eq("SHOW CREATE TABLE t FORMAT TSVRaw"), ArgumentMatchers.<RowMapper<String>>any()))
                .thenReturn(Collections.singletonList("CREATE TABLE t (a Int32) ENGINE = Memory"));

        assertTrue(catalog.getDdl("t").startsWith("CREATE TABLE t"));
    }

    @Test
    void testTemplateWithoutPlaceholderRejected() {
        assertThrows(CatalogException.class,
                () -> catalog.configure(Collections.singletonMap(JdbcCatalog.DDL_QUERY_KEY, "SHOW TABLES")));
    }

    @Test
    void testUnsafeTableNameNeverReachesDatabase() {
        assertThrows(CatalogException.class, () -> catalog.getDdl("t; DROP TABLE users"));
        verify(jdbcTemplate, never()).query(anyString(), ArgumentMatchers.<RowMapper<String>>any());
    }

    @Test
    void testDatabaseErrorBecomesCatalogException() {
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<String>>any()))
                .thenThrow(new BadSqlGrammarException("ddl", "SHOW CREATE TABLE nope",
                        new SQLException("Table 'nope' doesn't exist")));

        CatalogException e = assertThrows(CatalogException.class, () -> catalog.getDdl("nope"));
        assertTrue(e.getMessage().contains("doesn't exist"));
    }

    @Test
    void testEmptyResultMeansMissingTable() {
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<String>>any()))
                .thenReturn(Collections.emptyList());

        assertThrows(CatalogException.class, () -> catalog.getDdl("ghost"));
    }
}
