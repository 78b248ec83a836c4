package com.afsun.columnlineage.core.exceptions;

import lombok.Getter;

/**
 * 语句没有可追溯血缘的主体（DELETE、DROP、纯DDL等）
 * 分析器内部捕获并记录为跳过，不会抛给调用方
 *
 * @author afsun
 */
@Getter
public class UnsupportedStatementException extends LineageException {

    private final String statementType;

    public UnsupportedStatementException(String statementType, String reason) {
        super("UNSUPPORTED_STATEMENT", reason, null);
        this.statementType = statementType;
    }
}
