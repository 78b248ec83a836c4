package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import lombok.Getter;

/**
 * UPDATE target SET col = expr [FROM ...]
 */
@Getter
public class UpdateStatement extends ParsedStatement {

    private final TableName target;
    private final SQLUpdateStatement update;

    public UpdateStatement(int index, String sql, DbType dbType, SQLUpdateStatement update, TableName target) {
        super(index, sql, dbType, update);
        this.update = update;
        this.target = target;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.UPDATE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUpdate(this);
    }
}
