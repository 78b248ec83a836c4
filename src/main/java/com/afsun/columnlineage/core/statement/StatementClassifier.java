package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 Druid 语句归类为 {@link ParsedStatement} 的具体子类
 *
 * @author afsun
 */
public class StatementClassifier {

    private StatementClassifier() {
    }

    public static ParsedStatement classify(int index, String sql, DbType dbType, SQLStatement stmt) {
        if (stmt instanceof SQLSelectStatement) {
            return new QueryStatement(index, sql, dbType, stmt, ((SQLSelectStatement) stmt).getSelect());
        }

        if (stmt instanceof SQLInsertStatement) {
            SQLInsertStatement ins = (SQLInsertStatement) stmt;
            if (ins.getQuery() == null) {
                return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.INSERT,
                        "INSERT ... VALUES 没有查询来源");
            }
            List<String> declared = new ArrayList<>();
            for (SQLExpr c : ins.getColumns()) {
                declared.add(columnName(c));
            }
            return new WriteStatement(index, sql, dbType, stmt, StatementKind.INSERT,
                    TableName.parse(ins.getTableName().toString()), ins.getQuery(), declared, false, ins.getWith());
        }

        if (stmt instanceof SQLCreateViewStatement) {
            SQLCreateViewStatement v = (SQLCreateViewStatement) stmt;
            List<String> declared = new ArrayList<>();
            for (Object element : v.getColumns()) {
                declared.add(elementName(element));
            }
            return new WriteStatement(index, sql, dbType, stmt, StatementKind.CREATE,
                    TableName.parse(v.getName().toString()), v.getSubQuery(), declared, true);
        }

        if (stmt instanceof SQLCreateTableStatement) {
            SQLCreateTableStatement ct = (SQLCreateTableStatement) stmt;
            TableName target = TableName.parse(ct.getTableSource().getExpr().toString());
            if (ct.getSelect() != null) {
                return new WriteStatement(index, sql, dbType, stmt, StatementKind.CREATE,
                        target, ct.getSelect(), null, false);
            }
            List<String> columns = new ArrayList<>();
            for (SQLTableElement element : ct.getTableElementList()) {
                if (element instanceof SQLColumnDefinition) {
                    columns.add(elementName(element));
                }
            }
            if (columns.isEmpty()) {
                return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.CREATE,
                        "CREATE TABLE 没有列定义也没有 AS SELECT");
            }
            return new DdlStatement(index, sql, dbType, stmt, target, columns);
        }

        if (stmt instanceof SQLMergeStatement) {
            SQLMergeStatement mg = (SQLMergeStatement) stmt;
            TableName target = tableOf(mg.getInto());
            if (target == null) {
                return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.MERGE,
                        "MERGE 目标不是表: " + mg.getInto());
            }
            return new MergeStatement(index, sql, dbType, mg, target);
        }

        if (stmt instanceof SQLUpdateStatement) {
            SQLUpdateStatement up = (SQLUpdateStatement) stmt;
            if (up.getItems() == null || up.getItems().isEmpty()) {
                return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.UPDATE,
                        "UPDATE 没有 SET 子句");
            }
            TableName target = tableOf(up.getTableSource());
            if (target == null) {
                return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.UPDATE,
                        "UPDATE 目标不是表: " + up.getTableSource());
            }
            return new UpdateStatement(index, sql, dbType, up, target);
        }

        if (stmt instanceof SQLDeleteStatement) {
            return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.DELETE,
                    "DELETE 语句不产生列血缘");
        }

        return new UnsupportedStatement(index, sql, dbType, stmt, StatementKind.ADMINISTRATIVE,
                "语句类型 " + stmt.getClass().getSimpleName() + " 没有可追溯的查询主体");
    }

    /**
     * 取表源对应的真实表：JOIN 取最左侧的表。子查询等非表目标返回 null
     */
    public static TableName tableOf(SQLTableSource source) {
        SQLTableSource ts = source;
        while (ts instanceof SQLJoinTableSource) {
            ts = ((SQLJoinTableSource) ts).getLeft();
        }
        if (ts instanceof SQLExprTableSource) {
            return TableName.parse(((SQLExprTableSource) ts).getExpr().toString());
        }
        return null;
    }

    /**
     * 赋值/列清单中的列名，t.col 取 col
     */
    public static String columnName(SQLExpr expr) {
        if (expr instanceof SQLName) {
            return TableName.normalize(((SQLName) expr).getSimpleName());
        }
        return TableName.normalize(expr.toString());
    }

    private static String elementName(Object element) {
        if (element instanceof SQLColumnDefinition) {
            return TableName.normalize(((SQLColumnDefinition) element).getName().getSimpleName());
        }
        if (element instanceof SQLName) {
            return TableName.normalize(((SQLName) element).getSimpleName());
        }
        if (element instanceof SQLExpr) {
            return columnName((SQLExpr) element);
        }
        return TableName.normalize(String.valueOf(element));
    }
}
