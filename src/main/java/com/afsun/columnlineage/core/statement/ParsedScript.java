package com.afsun.columnlineage.core.statement;

import com.afsun.columnlineage.core.SkippedQuery;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个SQL脚本切分解析后的结果：成功解析的语句与无法解析的语句
 */
@Getter
public class ParsedScript {

    private final List<ParsedStatement> statements = new ArrayList<>();
    private final List<SkippedQuery> failures = new ArrayList<>();
    private RuntimeException firstError;

    void addStatement(ParsedStatement statement) {
        statements.add(statement);
    }

    void addFailure(SkippedQuery failure, RuntimeException error) {
        failures.add(failure);
        if (firstError == null) {
            firstError = error;
        }
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
