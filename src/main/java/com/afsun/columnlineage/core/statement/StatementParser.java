package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.SkippedQuery;
import com.afsun.columnlineage.core.util.Dialects;
import com.afsun.columnlineage.core.util.SqlScriptUtils;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.parser.ParserException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 脚本解析：去注释 → 分号切分 → 逐条交给 Druid 解析
 * 单条语句解析失败只记录，不影响其余语句
 *
 * @author afsun
 */
@Slf4j
public class StatementParser {

    public static final String UNPARSABLE = "Unparsable";

    private StatementParser() {
    }

    public static ParsedScript parse(String sqlText, DbType dbType) {
        ParsedScript script = new ParsedScript();
        if (sqlText == null) {
            return script;
        }
        String cleaned = SqlScriptUtils.stripComments(sqlText, Dialects.hashComments(dbType));
        List<String> fragments = SqlScriptUtils.splitStatements(cleaned);

        int index = 0;
        for (String fragment : fragments) {
            List<SQLStatement> parsed;
            try {
                parsed = SQLUtils.parseStatements(fragment, dbType);
            } catch (ParserException e) {
                log.warn("第{}条语句解析失败: {} | {}", index, e.getMessage(), SqlScriptUtils.preview(fragment));
                script.addFailure(new SkippedQuery(index, UNPARSABLE, "解析失败: " + e.getMessage(),
                        SqlScriptUtils.preview(fragment)), e);
                index++;
                continue;
            }
            for (SQLStatement stmt : parsed) {
                String text = parsed.size() == 1 ? fragment : SQLUtils.toSQLString(stmt, dbType);
                script.addStatement(classify(index, text, dbType, stmt));
                index++;
            }
        }
        return script;
    }

    /**
     * 语句结构无法识别时降级为不支持的语句，不影响同一脚本的其余语句
     */
    private static ParsedStatement classify(int index, String text, DbType dbType, SQLStatement stmt) {
        try {
            return StatementClassifier.classify(index, text, dbType, stmt);
        } catch (RuntimeException e) {
            log.warn("第{}条语句无法识别: {} | {}", index, e.getMessage(), SqlScriptUtils.preview(text));
            return new UnsupportedStatement(index, text, dbType, stmt, StatementKind.ADMINISTRATIVE,
                    "无法识别的语句结构: " + e.getMessage());
        }
    }
}
