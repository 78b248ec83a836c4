package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 以查询为来源的写入：INSERT ... SELECT、CREATE TABLE AS SELECT、CREATE VIEW
 */
@Getter
public class WriteStatement extends ParsedStatement {

    private final StatementKind kind;
    private final TableName target;
    private final SQLSelect select;
    /**
     * 显式声明的目标列，如 INSERT INTO t (a, b)；未声明时为空
     */
    private final List<String> declaredColumns;
    private final boolean view;
    /**
     * 写在语句最前面的 WITH，如 WITH c AS (...) INSERT INTO t SELECT ... FROM c；没有时为 null
     */
    private final SQLWithSubqueryClause with;

    public WriteStatement(int index, String sql, DbType dbType, SQLStatement ast, StatementKind kind,
                          TableName target, SQLSelect select, List<String> declaredColumns, boolean view) {
        this(index, sql, dbType, ast, kind, target, select, declaredColumns, view, null);
    }

    public WriteStatement(int index, String sql, DbType dbType, SQLStatement ast, StatementKind kind,
                          TableName target, SQLSelect select, List<String> declaredColumns, boolean view,
                          SQLWithSubqueryClause with) {
        super(index, sql, dbType, ast);
        this.kind = kind;
        this.target = target;
        this.select = select;
        this.declaredColumns = declaredColumns == null ? new ArrayList<>() : declaredColumns;
        this.view = view;
        this.with = with;
    }

    /**
     * CREATE 类语句执行后需要登记目标表的列
     */
    public boolean definesSchema() {
        return kind == StatementKind.CREATE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitWrite(this);
    }
}
