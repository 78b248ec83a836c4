package com.afsun.columnlineage.service;

import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.QueryTablesResult;
import com.afsun.columnlineage.vo.AnalysisResult;
import com.afsun.columnlineage.vo.GraphBuildRequest;
import com.afsun.columnlineage.vo.GraphBuildResult;

import java.util.List;
import java.util.Map;

/**
 * SQL血缘分析服务
 *
 * @author afsun
 */
public interface LineageAnalysisService {

    /**
     * 分析一段SQL文本的血缘
     *
     * @param dialect      方言，为空时使用配置的默认方言
     * @param column       正向：只看该输出列
     * @param sourceColumn 反向：依赖该来源列的输出
     * @param tableFilter  只分析引用了该表的语句
     */
    AnalysisResult analyze(String sql, String dialect, AnalysisLevel level, String column,
                           String sourceColumn, String tableFilter);

    List<QueryTablesResult> analyzeTables(String sql, String dialect, String tableFilter);

    /**
     * 只提取表结构
     */
    Map<String, List<String>> extractSchema(String sql, String dialect);

    /**
     * 从文件/目录/清单构建血缘图并写入文件，查询服务随即使用新图
     */
    GraphBuildResult buildGraph(GraphBuildRequest request);
}
