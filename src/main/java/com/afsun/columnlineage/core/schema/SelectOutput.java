package com.afsun.columnlineage.core.schema;

import com.alibaba.druid.sql.ast.SQLExpr;
import lombok.Getter;

/**
 * SELECT 列表展开后的一个输出列
 * 普通表达式带 expr；通配符展开得到的列带 origin；无法展开的通配符标记 unresolvedStar
 *
 * @author afsun
 */
@Getter
public class SelectOutput {

    private final String name;
    private final SQLExpr expr;
    private final boolean aliased;
    private final Relation origin;
    private final String starQualifier;
    private final boolean unresolvedStar;
    /**
     * 输出所在查询块的作用域
     */
    private final QueryScope scope;

    private SelectOutput(String name, SQLExpr expr, boolean aliased, Relation origin,
                         String starQualifier, boolean unresolvedStar, QueryScope scope) {
        this.name = name;
        this.expr = expr;
        this.aliased = aliased;
        this.origin = origin;
        this.starQualifier = starQualifier;
        this.unresolvedStar = unresolvedStar;
        this.scope = scope;
    }

    public static SelectOutput expression(String name, SQLExpr expr, boolean aliased, QueryScope scope) {
        return new SelectOutput(name, expr, aliased, null, null, false, scope);
    }

    public static SelectOutput star(String column, Relation origin, QueryScope scope) {
        return new SelectOutput(column, null, false, origin, null, false, scope);
    }

    /**
     * @param qualifier t.* 的 t，裸 * 为 null
     */
    public static SelectOutput unresolved(String qualifier, QueryScope scope) {
        String name = qualifier == null ? "*" : qualifier + ".*";
        return new SelectOutput(name, null, false, null, qualifier, true, scope);
    }

    public boolean isFromStar() {
        return origin != null;
    }

    @Override
    public String toString() {
        return name;
    }
}
