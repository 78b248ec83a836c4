package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.TableName;
import com.afsun.columnlineage.core.util.SqlScriptUtils;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import lombok.Getter;

/**
 * 已解析的单条语句。按语句类别分为若干子类，每个子类只携带自己需要的字段，
 * 通过 {@link Visitor} 做穷举分派。
 *
 * @author afsun
 */
@Getter
public abstract class ParsedStatement {

    private final int index;
    private final String sql;
    private final DbType dbType;
    private final SQLStatement ast;

    protected ParsedStatement(int index, String sql, DbType dbType, SQLStatement ast) {
        this.index = index;
        this.sql = sql;
        this.dbType = dbType;
        this.ast = ast;
    }

    public abstract StatementKind getKind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * 写入目标表，查询语句返回 null
     */
    public TableName getTarget() {
        return null;
    }

    /**
     * 是否存在可追溯血缘的主体
     */
    public boolean hasLineageBody() {
        return true;
    }

    public String getPreview() {
        return SqlScriptUtils.preview(sql);
    }

    /**
     * 语句类型名，如 SQLDeleteStatement → Delete
     */
    public String getTypeName() {
        String name = ast.getClass().getSimpleName();
        if (name.endsWith("Statement")) {
            name = name.substring(0, name.length() - "Statement".length());
        }
        if (name.startsWith("SQL")) {
            name = name.substring(3);
        }
        return name;
    }

    public interface Visitor<R> {
        R visitQuery(QueryStatement statement);

        R visitWrite(WriteStatement statement);

        R visitMerge(MergeStatement statement);

        R visitUpdate(UpdateStatement statement);

        R visitDdl(DdlStatement statement);

        R visitUnsupported(UnsupportedStatement statement);
    }
}
