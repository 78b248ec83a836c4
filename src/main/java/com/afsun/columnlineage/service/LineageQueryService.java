package com.afsun.columnlineage.service;

import com.afsun.columnlineage.graph.LineageGraph;
import com.afsun.columnlineage.vo.LineageQueryResult;

import java.util.List;

/**
 * 血缘图查询服务
 * 提供表级和列级的上下游查询
 *
 * @author afsun
 */
public interface LineageQueryService {

    /**
     * 查询列的上游（该列的数据来源于哪些列）
     */
    LineageQueryResult queryUpstreamColumn(String column);

    /**
     * 查询列的下游（该列的数据被哪些列使用）
     */
    LineageQueryResult queryDownstreamColumn(String column);

    /**
     * 查询表内全部列的上游汇总
     */
    LineageQueryResult queryUpstreamTable(String table);

    LineageQueryResult queryDownstreamTable(String table);

    List<String> listColumns();

    /**
     * 替换当前使用的血缘图
     */
    void reload(LineageGraph graph);
}
