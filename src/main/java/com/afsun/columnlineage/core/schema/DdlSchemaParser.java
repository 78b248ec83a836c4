package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.statement.DdlStatement;
import com.afsun.columnlineage.core.statement.ParsedScript;
import com.afsun.columnlineage.core.statement.ParsedStatement;
import com.afsun.columnlineage.core.statement.StatementParser;
import com.afsun.columnlineage.core.statement.WriteStatement;
import com.alibaba.druid.DbType;

import java.util.ArrayList;
import java.util.List;

/**
 * 从目录返回的 DDL 中提取列名
 * 只关心列名，不关心类型与约束
 */
public class DdlSchemaParser {

    private DdlSchemaParser() {
    }

    /**
     * @return 列名列表；DDL 中没有可识别的建表/建视图语句时为空
     * @throws SqlParseException DDL 无法解析
     */
    public static List<String> parseColumns(String ddl, DbType dbType) {
        ParsedScript script = StatementParser.parse(ddl, dbType);
        if (script.isEmpty() && script.getFirstError() != null) {
            throw new SqlParseException("DDL 解析失败: " + script.getFirstError().getMessage(), ddl,
                    script.getFirstError());
        }
        for (ParsedStatement statement : script.getStatements()) {
            if (statement instanceof DdlStatement) {
                return new ArrayList<>(((DdlStatement) statement).getColumns());
            }
            if (statement instanceof WriteStatement && ((WriteStatement) statement).isView()) {
                WriteStatement view = (WriteStatement) statement;
                if (!view.getDeclaredColumns().isEmpty()) {
                    return new ArrayList<>(view.getDeclaredColumns());
                }
                List<String> names = new ArrayList<>();
                SelectOutputResolver resolver = new SelectOutputResolver(SchemaContext.empty(), dbType);
                for (SelectOutput out : resolver.resolve(view.getSelect(), QueryScope.root())) {
                    if (!out.isUnresolvedStar()) {
                        names.add(out.getName());
                    }
                }
                return names;
            }
        }
        return new ArrayList<>();
    }
}
