package com.afsun.columnlineage.core.statement;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Getter;

/**
 * 没有血缘主体的语句：DELETE、DROP、USE、SET、INSERT ... VALUES 等
 */
@Getter
public class UnsupportedStatement extends ParsedStatement {

    private final StatementKind kind;
    private final String reason;

    public UnsupportedStatement(int index, String sql, DbType dbType, SQLStatement ast, StatementKind kind, String reason) {
        super(index, sql, dbType, ast);
        this.kind = kind;
        this.reason = reason;
    }

    @Override
    public boolean hasLineageBody() {
        return false;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }
}
