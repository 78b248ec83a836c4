package com.afsun.columnlineage.service.impl;

import com.afsun.columnlineage.catalog.CatalogRegistry;
import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.ColumnLineageExtractor;
import com.afsun.columnlineage.core.QueryLineageResult;
import com.afsun.columnlineage.core.QueryTablesResult;
import com.afsun.columnlineage.core.exceptions.InternalParseException;
import com.afsun.columnlineage.core.exceptions.LineageException;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.afsun.columnlineage.core.util.Dialects;
import com.afsun.columnlineage.graph.GraphBuildOptions;
import com.afsun.columnlineage.graph.LineageGraph;
import com.afsun.columnlineage.graph.LineageGraphBuilder;
import com.afsun.columnlineage.graph.LineageGraphSerializer;
import com.afsun.columnlineage.service.LineageAnalysisService;
import com.afsun.columnlineage.service.LineageQueryService;
import com.afsun.columnlineage.vo.AnalysisResult;
import com.afsun.columnlineage.vo.GraphBuildRequest;
import com.afsun.columnlineage.vo.GraphBuildResult;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * @author afsun
 * @date 2025-11-04日 15:17
 */
@Service
@Slf4j
public class LineageAnalysisServiceImpl implements LineageAnalysisService {

    @Resource
    private LineageProperties properties;

    @Resource
    private ColumnLineageTracer tracer;

    @Resource
    private CatalogRegistry catalogRegistry;

    @Resource
    private LineageQueryService lineageQueryService;

    @Resource
    private Clock clock;

    private final LineageGraphSerializer serializer = new LineageGraphSerializer();

    @Override
    public AnalysisResult analyze(String sql, String dialect, AnalysisLevel level, String column,
                                  String sourceColumn, String tableFilter) {
        long startTime = System.currentTimeMillis();
        String traceId = "LN-" + startTime;
        return guard(traceId, () -> {
            DbType dbType = Dialects.resolve(dialect == null ? properties.getDialect() : dialect, sql);
            ColumnLineageExtractor extractor = new ColumnLineageExtractor(sql, dbType,
                    properties.toExtractorOptions(), null, tracer);
            List<QueryLineageResult> queries = extractor.analyzeQueries(
                    level == null ? AnalysisLevel.COLUMN : level, column, sourceColumn, tableFilter);

            AnalysisResult result = new AnalysisResult();
            result.setTraceId(traceId);
            result.setDialect(dbType.name());
            result.setLevel(level == null ? AnalysisLevel.COLUMN : level);
            result.setQueries(queries);
            result.setSkippedQueries(extractor.getSkippedQueries());
            result.setParseMillis(System.currentTimeMillis() - startTime);
            log.info("SQL分析完成, traceId: {}, 语句结果: {}, 跳过: {}, 耗时: {}ms", traceId, queries.size(),
                    result.getSkippedQueries().size(), result.getParseMillis());
            return result;
        });
    }

    @Override
    public List<QueryTablesResult> analyzeTables(String sql, String dialect, String tableFilter) {
        String traceId = "LN-" + System.currentTimeMillis();
        return guard(traceId, () -> {
            DbType dbType = Dialects.resolve(dialect == null ? properties.getDialect() : dialect, sql);
            return new ColumnLineageExtractor(sql, dbType, properties.toExtractorOptions(), null, tracer)
                    .analyzeTables(tableFilter);
        });
    }

    @Override
    public Map<String, List<String>> extractSchema(String sql, String dialect) {
        String traceId = "LN-" + System.currentTimeMillis();
        return guard(traceId, () -> {
            DbType dbType = Dialects.resolve(dialect == null ? properties.getDialect() : dialect, sql);
            return new ColumnLineageExtractor(sql, dbType, properties.toExtractorOptions(), null, tracer)
                    .extractSchemaOnly().asMap();
        });
    }

    @Override
    public GraphBuildResult buildGraph(GraphBuildRequest request) {
        long startTime = System.currentTimeMillis();
        String traceId = "LN-" + startTime;
        if (request.getPaths() == null || request.getPaths().isEmpty()) {
            throw new IllegalArgumentException("paths 不能为空");
        }
        boolean resolveSchema = request.getResolveSchema() == null
                ? properties.isResolveSchema() : request.getResolveSchema();
        GraphBuildOptions.GraphBuildOptionsBuilder options = GraphBuildOptions.builder()
                .dialect(request.getDialect() == null ? properties.getDialect() : request.getDialect())
                .nodeFormat(properties.getNodeFormat())
                .noStar(properties.isNoStar())
                .strictSchema(properties.isStrictSchema())
                .resolveSchema(resolveSchema)
                .maxFileSize(properties.getMaxFileSize())
                .clock(clock)
                .tracer(tracer);
        String catalogType = properties.getCatalog().getType();
        if (resolveSchema && catalogType != null && !catalogType.isEmpty()) {
            options.catalog(catalogRegistry.create(catalogType, properties.getCatalog().getConfig()));
        }
        LineageGraphBuilder builder = new LineageGraphBuilder(options.build());

        LineageGraph graph;
        Path output = Paths.get(request.getOutput() == null ? properties.getGraphFile() : request.getOutput());
        try {
            for (String p : request.getPaths()) {
                Path path = Paths.get(p);
                if (Files.isDirectory(path)) {
                    builder.addDirectory(path, request.isRecursive(), request.getGlob(), request.getDialect());
                } else if (p.toLowerCase(Locale.ROOT).endsWith(".csv")) {
                    builder.addManifest(path, request.getDialect());
                } else {
                    builder.addFile(path, request.getDialect());
                }
            }
            graph = builder.build();
            serializer.save(graph, output);
        } catch (IOException e) {
            throw new LineageException("GRAPH_IO", "血缘图构建失败: " + e.getMessage(), "检查路径是否存在且可读写",
                    null, e);
        }
        lineageQueryService.reload(graph);

        GraphBuildResult result = new GraphBuildResult();
        result.setTraceId(traceId);
        result.setOutputFile(output.toAbsolutePath().toString());
        result.setMetadata(graph.getMetadata());
        result.setSkippedFiles(builder.getSkippedFiles());
        result.setSkippedQueries(builder.getSkippedQueries());
        if (builder.getSchemaResolution() != null) {
            result.setFailedTables(builder.getSchemaResolution().getFailedTables());
        }
        result.setBuildMillis(System.currentTimeMillis() - startTime);
        log.info("血缘图构建完成, traceId: {}, 节点: {}, 边: {}, 输出: {}, 耗时: {}ms", traceId,
                graph.getMetadata().getTotalNodes(), graph.getMetadata().getTotalEdges(), output,
                result.getBuildMillis());
        return result;
    }

    /**
     * 业务异常原样抛出，未预期异常包装为 InternalParseException
     */
    private <T> T guard(String traceId, Supplier<T> action) {
        try {
            return action.get();
        } catch (LineageException | IllegalArgumentException e) {
            log.warn("SQL分析业务异常, traceId={}: {} - {}", traceId, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("SQL分析发生未预期异常, traceId={}", traceId, e);
            throw new InternalParseException("脚本解析异常: " + e.getMessage(), traceId, e);
        }
    }
}
