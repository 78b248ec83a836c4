package com.afsun.columnlineage.core;

import com.alibaba.druid.DbType;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一段待分析的SQL文本及其来源（文件路径或调用方给定的名字）
 */
@Data
@AllArgsConstructor
public class SqlSource {
    private String sql;
    private String sourceName;
    private DbType dbType;
}
