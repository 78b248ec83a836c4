package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.SkippedQuery;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLIntegerExpr;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementParserTest {

    @Test
    void testClassifiesEachStatementKind() {
        String sql = "SELECT a FROM t;\n"
                + "INSERT INTO t2 (a) SELECT a FROM t;\n"
                + "CREATE TABLE t3 (id INT, name VARCHAR(20));\n"
                + "CREATE VIEW v AS SELECT a FROM t;\n"
                + "CREATE TABLE t4 AS SELECT a FROM t;\n"
                + "UPDATE t SET a = 1 WHERE b = 2;\n"
                + "DELETE FROM t WHERE a = 1;\n"
                + "INSERT INTO t2 (a) VALUES (1);\n"
                + "DROP TABLE t5";
        ParsedScript script = StatementParser.parse(sql, DbType.mysql);

        List<ParsedStatement> statements = script.getStatements();
        assertEquals(9, statements.size());
        assertTrue(statements.get(0) instanceof QueryStatement);
        assertTrue(statements.get(1) instanceof WriteStatement);
        assertTrue(statements.get(2) instanceof DdlStatement);
        assertTrue(statements.get(3) instanceof WriteStatement);
        assertTrue(((WriteStatement) statements.get(3)).isView());
        assertTrue(statements.get(4) instanceof WriteStatement);
        assertTrue(((WriteStatement) statements.get(4)).definesSchema());
        assertTrue(statements.get(5) instanceof UpdateStatement);
        assertTrue(statements.get(6) instanceof UnsupportedStatement);
        assertEquals(StatementKind.DELETE, statements.get(6).getKind());
        assertTrue(statements.get(7) instanceof UnsupportedStatement);
        assertEquals(StatementKind.INSERT, statements.get(7).getKind());
        assertEquals(StatementKind.ADMINISTRATIVE, statements.get(8).getKind());
        assertFalse(statements.get(8).hasLineageBody());
    }

    @Test
    void testTargetsAndDeclaredColumns() {
        ParsedScript script = StatementParser.parse(
                "INSERT INTO `DW`.`Orders` (Id, Amount) SELECT id, amt FROM ods.orders", DbType.mysql);
        WriteStatement write = (WriteStatement) script.getStatements().get(0);
        assertEquals("dw.orders", write.getTarget().qualified());
        assertEquals(Arrays.asList("id", "amount"), write.getDeclaredColumns());
        assertFalse(write.definesSchema());
    }

    @Test
    void testDdlColumnsAreLowercased() {
        ParsedScript script = StatementParser.parse("CREATE TABLE ods.Users (ID INT, UserName VARCHAR(20))",
                DbType.mysql);
        DdlStatement ddl = (DdlStatement) script.getStatements().get(0);
        assertEquals("ods.users", ddl.getTarget().qualified());
        assertEquals(Arrays.asList("id", "username"), ddl.getColumns());
        assertFalse(ddl.hasLineageBody());
    }

    @Test
    void testUnparsableStatementIsRecordedAndOthersSurvive() {
        ParsedScript script = StatementParser.parse("SELECT a FROM t; SELEC broken FROM; SELECT b FROM t",
                DbType.mysql);

        assertEquals(2, script.getStatements().size());
        assertEquals(0, script.getStatements().get(0).getIndex());
        assertEquals(2, script.getStatements().get(1).getIndex());
        assertEquals(1, script.getFailures().size());
        SkippedQuery failure = script.getFailures().get(0);
        assertEquals(1, failure.getQueryIndex());
        assertEquals(StatementParser.UNPARSABLE, failure.getStatementType());
        assertNotNull(script.getFirstError());
    }

    @Test
    void testCommentsOnlyScriptIsEmpty() {
        ParsedScript script = StatementParser.parse("-- nothing here\n/* still nothing */", DbType.mysql);
        assertTrue(script.isEmpty());
        assertNull(script.getFirstError());
    }

    @Test
    void testWithBeforeInsertIsKept() {
        ParsedScript script = StatementParser.parse(
                "WITH c AS (SELECT a FROM src) INSERT INTO TABLE tgt SELECT a FROM c", DbType.hive);

        WriteStatement write = (WriteStatement) script.getStatements().get(0);
        assertEquals("tgt", write.getTarget().qualified());
        assertNotNull(write.getWith());
        assertEquals("c", write.getWith().getEntries().get(0).getAlias());
    }

    @Test
    void testNonTableTargetIsUnsupported() {
        assertNull(StatementClassifier.tableOf(new SQLSubqueryTableSource(new SQLSelect())));

        // UPDATE (SELECT ...) v SET x = 1
        SQLUpdateStatement update = new SQLUpdateStatement();
        update.setTableSource(new SQLSubqueryTableSource(new SQLSelect()));
        SQLUpdateSetItem item = new SQLUpdateSetItem();
        item.setColumn(new SQLIdentifierExpr("x"));
        item.setValue(new SQLIntegerExpr(1));
        update.addItem(item);

        ParsedStatement parsed = StatementClassifier.classify(0, "UPDATE (SELECT x FROM s) v SET x = 1",
                DbType.oracle, update);
        assertTrue(parsed instanceof UnsupportedStatement);
        assertFalse(parsed.hasLineageBody());
    }
}
