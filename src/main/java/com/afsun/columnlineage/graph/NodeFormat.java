package com.afsun.columnlineage.graph;

/**
 * 节点标识的输出形式
 */
public enum NodeFormat {
    /**
     * 单个限定名字符串 schema.table.column
     */
    QUALIFIED,
    /**
     * 拆分为 schema/table/column 三段
     */
    STRUCTURED
}
