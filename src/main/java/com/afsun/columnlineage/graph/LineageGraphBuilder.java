package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.ColumnLineageExtractor;
import com.afsun.columnlineage.core.ExtractorOptions;
import com.afsun.columnlineage.core.LineageItem;
import com.afsun.columnlineage.core.QueryLineageResult;
import com.afsun.columnlineage.core.SkippedQuery;
import com.afsun.columnlineage.core.SqlSource;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.schema.SchemaContext;
import com.afsun.columnlineage.core.schema.SchemaResolution;
import com.afsun.columnlineage.core.schema.SchemaResolver;
import com.afsun.columnlineage.core.util.Dialects;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 从多个 SQL 文件构建去重的列级血缘图
 * <p>
 * resolveSchema 开启时采用两遍构建：第一遍收集全部文件的表结构（可选目录补全），
 * 第二遍带着该 schema 逐文件分析。单个文件或语句失败只记录，不中断构建；
 * 通配符在 noStar 模式下无法展开时直接抛出。
 *
 * @author afsun
 */
@Slf4j
public class LineageGraphBuilder {

    private final GraphBuildOptions options;
    private final ExtractorOptions extractorOptions;
    private final GraphAccumulator graph = new GraphAccumulator();
    private final List<SkippedFile> skippedFiles = new ArrayList<>();
    private final Map<String, List<SkippedQuery>> skippedQueries = new LinkedHashMap<>();
    private SchemaResolution schemaResolution;

    public LineageGraphBuilder() {
        this(GraphBuildOptions.builder().build());
    }

    public LineageGraphBuilder(GraphBuildOptions options) {
        this.options = options;
        this.extractorOptions = options.toExtractorOptions();
    }

    public LineageGraphBuilder addSql(String sql, String sourceName, String dialect) {
        String tag = dialect == null ? options.getDialect() : dialect;
        return addSources(Collections.singletonList(new SqlSource(sql, sourceName, Dialects.resolve(tag, sql))));
    }

    public LineageGraphBuilder addFile(Path file, String dialect) {
        return addFiles(Collections.singletonList(file), dialect);
    }

    /**
     * 同一批文件共享第一遍收集的 schema
     */
    public LineageGraphBuilder addFiles(List<Path> files, String dialect) {
        List<FileEntry> entries = new ArrayList<>();
        for (Path file : files) {
            entries.add(new FileEntry(file, dialect));
        }
        return addSources(readSources(entries));
    }

    /**
     * @throws IllegalArgumentException dir 不是目录
     */
    public LineageGraphBuilder addDirectory(Path dir, boolean recursive, String glob, String dialect)
            throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("不是目录: " + dir);
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + (glob == null ? "*.sql" : glob));
        List<Path> files;
        try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.info("目录 {} 下找到 {} 个SQL文件", dir, files.size());
        return addFiles(files, dialect);
    }

    /**
     * 清单中的相对路径相对于清单所在目录；方言优先级：清单项 > 参数 > 默认
     */
    public LineageGraphBuilder addManifest(Path manifestPath, String dialect) throws IOException {
        Manifest manifest = Manifest.fromCsv(manifestPath);
        Path base = manifestPath.toAbsolutePath().getParent();
        List<FileEntry> entries = new ArrayList<>();
        for (Manifest.Entry entry : manifest.getEntries()) {
            Path file = base.resolve(entry.getFilePath()).normalize();
            entries.add(new FileEntry(file, entry.getDialect() != null ? entry.getDialect() : dialect));
        }
        return addSources(readSources(entries));
    }

    public LineageGraphBuilder addSources(List<SqlSource> sources) {
        SchemaContext schema = options.getInitialSchema();
        if (options.isResolveSchema() && !sources.isEmpty()) {
            SchemaResolver resolver = new SchemaResolver(extractorOptions, options.getTracer());
            SchemaContext gathered = resolver.gather(sources, schema);
            schemaResolution = options.getCatalog() == null
                    ? new SchemaResolution(gathered)
                    : resolver.fillFromCatalog(gathered, sources, options.getCatalog());
            schema = schemaResolution.getSchema();
        }
        for (SqlSource source : sources) {
            analyze(source, schema);
        }
        return this;
    }

    public LineageGraph build() {
        String createdAt = Instant.now(options.getClock()).toString();
        LineageGraph result = graph.toGraph(options.getNodeFormat(), options.getDialect(), createdAt);
        log.info("血缘图构建完成: 节点={}, 边={}, 文件={}, 跳过文件={}", result.getNodes().size(),
                result.getEdges().size(), result.getMetadata().getSourceFiles().size(), skippedFiles.size());
        return result;
    }

    public List<SkippedFile> getSkippedFiles() {
        return Collections.unmodifiableList(skippedFiles);
    }

    /**
     * 文件 → 该文件中被跳过的语句
     */
    public Map<String, List<SkippedQuery>> getSkippedQueries() {
        return Collections.unmodifiableMap(skippedQueries);
    }

    /**
     * 最近一次两遍构建的 schema 解析结果，未开启时为 null
     */
    public SchemaResolution getSchemaResolution() {
        return schemaResolution;
    }

    private void analyze(SqlSource source, SchemaContext schema) {
        String name = source.getSourceName();
        List<QueryLineageResult> results;
        ColumnLineageExtractor extractor;
        try {
            extractor = new ColumnLineageExtractor(source.getSql(), source.getDbType(), extractorOptions,
                    schema, options.getTracer());
            results = extractor.analyzeQueries(AnalysisLevel.COLUMN);
        } catch (SqlParseException e) {
            log.warn("跳过文件 {}: {}", name, e.getMessage());
            skippedFiles.add(new SkippedFile(name, e.getMessage()));
            return;
        }
        List<SkippedQuery> skipped = extractor.getSkippedQueries();
        for (SkippedQuery q : skipped) {
            log.warn("跳过 {} 第{}条语句 [{}]: {}", name, q.getQueryIndex(), q.getStatementType(), q.getReason());
        }
        if (!skipped.isEmpty()) {
            skippedQueries.put(name, new ArrayList<>(skipped));
        }
        graph.addSourceFile(name);
        int edgesBefore = graph.edgeCount();
        for (QueryLineageResult result : results) {
            for (LineageItem item : result.getItems()) {
                graph.addItem(item, name, result.getQueryIndex());
            }
        }
        log.debug("{}: {} 条语句产生血缘, 新增边 {}", name, results.size(), graph.edgeCount() - edgesBefore);
    }

    private List<SqlSource> readSources(List<FileEntry> entries) {
        List<SqlSource> sources = new ArrayList<>();
        for (FileEntry entry : entries) {
            String name = entry.file.toAbsolutePath().normalize().toString();
            try {
                long size = Files.size(entry.file);
                if (options.getMaxFileSize() > 0 && size > options.getMaxFileSize()) {
                    log.warn("跳过文件 {}: 大小 {} 超过上限 {}", name, size, options.getMaxFileSize());
                    skippedFiles.add(new SkippedFile(name, "文件过大: " + size + " 字节"));
                    continue;
                }
                String sql = new String(Files.readAllBytes(entry.file), StandardCharsets.UTF_8);
                if (options.getPreprocessor() != null) {
                    sql = options.getPreprocessor().process(sql, entry.file);
                }
                String tag = entry.dialect == null ? options.getDialect() : entry.dialect;
                sources.add(new SqlSource(sql, name, Dialects.resolve(tag, sql)));
            } catch (IOException e) {
                log.warn("读取文件 {} 失败: {}", name, e.getMessage());
                skippedFiles.add(new SkippedFile(name, "读取失败: " + e.getMessage()));
            }
        }
        return sources;
    }

    private static class FileEntry {
        private final Path file;
        private final String dialect;

        FileEntry(Path file, String dialect) {
            this.file = file;
            this.dialect = dialect;
        }
    }
}
