package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * FROM 子句中可被引用的一个来源：真实表、CTE、派生表或 LATERAL VIEW 生成的列
 *
 * @author afsun
 */
@Getter
public class Relation {

    public enum Kind {
        TABLE,
        CTE,
        SUBQUERY,
        LATERAL
    }

    private final Kind kind;
    /**
     * 在作用域中的引用名（别名，无别名时为表名）
     */
    private final String alias;
    private final TableName table;
    private final SQLSelectQuery query;
    /**
     * 派生查询的求值作用域（只包含其可见的 CTE）
     */
    private final QueryScope queryScope;
    /**
     * CTE 显式声明的列名 WITH x (a, b) AS (...)
     */
    private final List<String> declaredColumns;
    private final SQLExpr lateralExpr;
    /**
     * 绑定该关系的作用域，LATERAL 表达式在其中求值
     */
    private final QueryScope ownerScope;
    /**
     * SEMI/ANTI JOIN 右侧：只参与过滤，不出现在 SELECT * 中
     */
    private final boolean filterOnly;

    private Relation(Kind kind, String alias, TableName table, SQLSelectQuery query, QueryScope queryScope,
                     List<String> declaredColumns, SQLExpr lateralExpr, QueryScope ownerScope, boolean filterOnly) {
        this.kind = kind;
        this.alias = alias;
        this.table = table;
        this.query = query;
        this.queryScope = queryScope;
        this.declaredColumns = declaredColumns == null ? new ArrayList<>() : declaredColumns;
        this.lateralExpr = lateralExpr;
        this.ownerScope = ownerScope;
        this.filterOnly = filterOnly;
    }

    public static Relation table(String alias, TableName table, boolean filterOnly) {
        return new Relation(Kind.TABLE, alias, table, null, null, null, null, null, filterOnly);
    }

    public static Relation cte(String alias, QueryScope.CteDefinition cte, boolean filterOnly) {
        return new Relation(Kind.CTE, alias, null, cte.getQuery(), cte.getScope(), cte.getColumns(),
                null, null, filterOnly);
    }

    public static Relation subquery(String alias, SQLSelectQuery query, QueryScope queryScope, boolean filterOnly) {
        return new Relation(Kind.SUBQUERY, alias, null, query, queryScope, null, null, null, filterOnly);
    }

    public static Relation lateral(String alias, List<String> columns, SQLExpr expr, QueryScope ownerScope) {
        return new Relation(Kind.LATERAL, alias, null, null, null, columns, expr, ownerScope, false);
    }

    public boolean isDerived() {
        return kind == Kind.CTE || kind == Kind.SUBQUERY;
    }

    /**
     * 血缘中使用的名字：真实表取限定名，其余取别名（CTE 为其名称）
     */
    public String lineageName() {
        return kind == Kind.TABLE ? table.qualified() : alias;
    }

    @Override
    public String toString() {
        return kind + "(" + alias + (table == null ? "" : " -> " + table) + ")";
    }
}
