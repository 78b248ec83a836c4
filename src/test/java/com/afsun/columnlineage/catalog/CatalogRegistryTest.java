package com.afsun.columnlineage.catalog;

import com.afsun.columnlineage.core.exceptions.CatalogException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CatalogRegistryTest {

    @Test
    void testCreateConfiguresNewInstance() {
        CatalogRegistry registry = new CatalogRegistry().register("Memory", MemoryCatalog::new);

        Catalog catalog = registry.create("memory", Collections.singletonMap("prefix", "db_"));

        assertTrue(catalog instanceof MemoryCatalog);
        assertEquals("db_", ((MemoryCatalog) catalog).prefix);
        assertNotSame(catalog, registry.create("MEMORY", null));
        assertTrue(registry.contains("memory"));
        assertEquals(Collections.singletonList("memory"), registry.names());
    }

    @Test
    void testUnknownCatalogListsAvailable() {
        CatalogRegistry registry = new CatalogRegistry()
                .register("b", MemoryCatalog::new)
                .register("a", MemoryCatalog::new);

        CatalogException e = assertThrows(CatalogException.class, () -> registry.create("oracle", null));
        assertTrue(e.getMessage().contains("oracle"));
        assertEquals(Arrays.asList("a", "b"), registry.names());
    }

    @Test
    void testBatchMarksFailuresWithPrefix() {
        Map<String, String> results = new MemoryCatalog().getDdlBatch(Arrays.asList("known", "missing"));

        assertEquals("CREATE TABLE known (id INT)", results.get("known"));
        assertTrue(results.get("missing").startsWith(Catalog.ERROR_PREFIX));
    }

    private static class MemoryCatalog implements Catalog {
        private String prefix;

        @Override
        public String name() {
            return "memory";
        }

        @Override
        public String getDdl(String tableName) {
            if ("known".equals(tableName)) {
                return "CREATE TABLE known (id INT)";
            }
            throw new CatalogException("目录中不存在表: " + tableName);
        }

        @Override
        public void configure(Map<String, String> config) {
            this.prefix = config.get("prefix");
        }
    }
}
