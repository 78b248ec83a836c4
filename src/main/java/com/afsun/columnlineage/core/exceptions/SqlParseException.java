package com.afsun.columnlineage.core.exceptions;

/**
 * 语句无法被解析
 * 仅对出错的那条语句是致命的，批量构建会记录后继续
 *
 * @author afsun
 */
public class SqlParseException extends LineageException {

    public SqlParseException(String message, String sqlFragment, Throwable cause) {
        super("PARSE_FAILURE", message, "检查方言设置或语句语法", sqlFragment, cause);
    }

    public SqlParseException(String message) {
        super("PARSE_FAILURE", message, "检查方言设置或语句语法");
    }
}
