package com.afsun.columnlineage.core.statement;

/**
 * 语句类别
 */
public enum StatementKind {
    QUERY,
    INSERT,
    CREATE,
    MERGE,
    UPDATE,
    DELETE,
    ADMINISTRATIVE
}
