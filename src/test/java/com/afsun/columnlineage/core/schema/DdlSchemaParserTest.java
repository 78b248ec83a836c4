package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.alibaba.druid.DbType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DdlSchemaParserTest {

    @Test
    void testShowCreateTableOutput() {
        String ddl = "CREATE TABLE `orders` (\n"
                + "  `id` bigint NOT NULL AUTO_INCREMENT,\n"
                + "  `Customer_Id` bigint DEFAULT NULL,\n"
                + "  `amount` decimal(10,2) DEFAULT NULL,\n"
                + "  PRIMARY KEY (`id`)\n"
                + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
        assertEquals(Arrays.asList("id", "customer_id", "amount"), DdlSchemaParser.parseColumns(ddl, DbType.mysql));
    }

    @Test
    void testViewDefinitionUsesSelectOutputs() {
        String ddl = "CREATE VIEW v_orders AS SELECT o.id, o.amount AS total FROM orders o";
        assertEquals(Arrays.asList("id", "total"), DdlSchemaParser.parseColumns(ddl, DbType.mysql));
    }

    @Test
    void testNonDdlReturnsEmpty() {
        assertTrue(DdlSchemaParser.parseColumns("SELECT 1", DbType.mysql).isEmpty());
    }

    @Test
    void testBrokenDdlThrows() {
        assertThrows(SqlParseException.class, () -> DdlSchemaParser.parseColumns("CREATE TABLE (", DbType.mysql));
    }
}
