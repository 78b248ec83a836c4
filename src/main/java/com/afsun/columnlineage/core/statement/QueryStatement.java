package com.afsun.columnlineage.core.statement;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import lombok.Getter;

/**
 * SELECT / UNION 查询
 */
@Getter
public class QueryStatement extends ParsedStatement {

    private final SQLSelect select;

    public QueryStatement(int index, String sql, DbType dbType, SQLStatement ast, SQLSelect select) {
        super(index, sql, dbType, ast);
        this.select = select;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.QUERY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitQuery(this);
    }
}
