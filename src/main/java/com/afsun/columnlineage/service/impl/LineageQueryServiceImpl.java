package com.afsun.columnlineage.service.impl;

import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.exceptions.LineageException;
import com.afsun.columnlineage.graph.LineageGraph;
import com.afsun.columnlineage.graph.LineageGraphQuerier;
import com.afsun.columnlineage.service.LineageQueryService;
import com.afsun.columnlineage.vo.LineageQueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * 血缘查询服务实现
 * 基于本地血缘图文件进行查询，首次查询时加载
 *
 * @author afsun
 */
@Service
@Slf4j
public class LineageQueryServiceImpl implements LineageQueryService {

    private final LineageProperties properties;

    private volatile LineageGraphQuerier querier;

    public LineageQueryServiceImpl(LineageProperties properties) {
        this.properties = properties;
    }

    @Override
    public LineageQueryResult queryUpstreamColumn(String column) {
        return run("列上游", column, q -> q.findUpstream(column));
    }

    @Override
    public LineageQueryResult queryDownstreamColumn(String column) {
        return run("列下游", column, q -> q.findDownstream(column));
    }

    @Override
    public LineageQueryResult queryUpstreamTable(String table) {
        return run("表上游", table, q -> q.findUpstreamTable(table));
    }

    @Override
    public LineageQueryResult queryDownstreamTable(String table) {
        return run("表下游", table, q -> q.findDownstreamTable(table));
    }

    @Override
    public List<String> listColumns() {
        return querier().listColumns();
    }

    @Override
    public void reload(LineageGraph graph) {
        this.querier = new LineageGraphQuerier(graph);
        log.info("血缘图已更新, 节点: {}, 边: {}", graph.getNodes().size(), graph.getEdges().size());
    }

    private LineageQueryResult run(String kind, String source, Function<LineageGraphQuerier, LineageQueryResult> query) {
        LineageQueryResult result = query.apply(querier());
        log.info("查询{}依赖完成: {}, 找到{}个节点, 耗时{}ms", kind, source, result.getRelatedNodes().size(),
                result.getQueryMillis());
        return result;
    }

    private LineageGraphQuerier querier() {
        LineageGraphQuerier current = querier;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (querier == null) {
                Path path = Paths.get(properties.getGraphFile());
                if (!Files.exists(path)) {
                    throw new LineageException("GRAPH_NOT_FOUND", "血缘图文件不存在: " + path.toAbsolutePath(),
                            "先调用 /sql/lineage/graph/build 构建血缘图");
                }
                try {
                    querier = LineageGraphQuerier.fromFile(path);
                } catch (IOException e) {
                    throw new LineageException("GRAPH_INVALID", "血缘图文件读取失败: " + e.getMessage(),
                            "检查文件是否为有效的血缘图 JSON", null, e);
                }
                log.info("已加载血缘图: {}", path.toAbsolutePath());
            }
            return querier;
        }
    }
}
