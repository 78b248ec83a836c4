package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.statement.SQLMergeStatement;
import lombok.Getter;

/**
 * MERGE INTO target USING source ... WHEN MATCHED / WHEN NOT MATCHED
 */
@Getter
public class MergeStatement extends ParsedStatement {

    private final TableName target;
    private final SQLMergeStatement merge;

    public MergeStatement(int index, String sql, DbType dbType, SQLMergeStatement merge, TableName target) {
        super(index, sql, dbType, merge);
        this.merge = merge;
        this.target = target;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.MERGE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMerge(this);
    }
}
