package com.afsun.columnlineage.core.trace;

import com.alibaba.druid.DbType;

import java.util.List;
import java.util.Map;

/**
 * 列血缘原语：给定输出列名与整条语句文本，返回该列的依赖树
 */
public interface ColumnLineageTracer {

    /**
     * @param column  输出列名（SELECT 中的别名/列名/表达式文本，MERGE/UPDATE 中为目标列名）
     * @param sql     完整语句文本
     * @param dbType  方言
     * @param schema  已裁剪的 schema（表 → 列），用于展开通配符，可为空
     * @return 依赖树，根节点名为 column
     */
    DependencyNode trace(String column, String sql, DbType dbType, Map<String, List<String>> schema);
}
