package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Getter;

import java.util.List;

/**
 * 纯建表语句 CREATE TABLE t (col ...)：只贡献列定义，不产生血缘
 */
@Getter
public class DdlStatement extends ParsedStatement {

    private final TableName target;
    private final List<String> columns;

    public DdlStatement(int index, String sql, DbType dbType, SQLStatement ast, TableName target, List<String> columns) {
        super(index, sql, dbType, ast);
        this.target = target;
        this.columns = columns;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.CREATE;
    }

    @Override
    public boolean hasLineageBody() {
        return false;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDdl(this);
    }
}
