package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.catalog.Catalog;
import com.afsun.columnlineage.core.ColumnLineageExtractor;
import com.afsun.columnlineage.core.ExtractorOptions;
import com.afsun.columnlineage.core.SqlSource;
import com.afsun.columnlineage.core.TableName;
import com.afsun.columnlineage.core.exceptions.CatalogException;
import com.afsun.columnlineage.core.exceptions.SchemaResolutionException;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.statement.ParsedStatement;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 两遍构建的第一遍：从全部 SQL 中收集表结构，可选地由目录补全缺失的表
 * <p>
 * 收集按来源顺序重复进行，直到 schema 不再变化，因此视图定义所在文件的先后不影响结果。
 * 文件中定义的表结构总是优先于目录返回的结构。
 *
 * @author afsun
 */
@Slf4j
public class SchemaResolver {

    private final ExtractorOptions options;
    private final ColumnLineageTracer tracer;

    public SchemaResolver(ExtractorOptions options, ColumnLineageTracer tracer) {
        this.options = options;
        this.tracer = tracer;
    }

    /**
     * @throws SchemaResolutionException strictSchema 下存在无法归属的列
     */
    public SchemaContext gather(List<SqlSource> sources, SchemaContext initial) {
        SchemaContext schema = initial == null ? SchemaContext.empty() : initial.copy();
        int maxRounds = sources.size() + 1;
        for (int round = 1; round <= maxRounds; round++) {
            Map<String, List<String>> before = schema.asMap();
            for (SqlSource source : sources) {
                try {
                    ColumnLineageExtractor extractor = new ColumnLineageExtractor(source.getSql(),
                            source.getDbType(), options, schema, tracer);
                    schema.putAll(extractor.extractSchemaOnly());
                } catch (SqlParseException e) {
                    // 第二遍会把该文件记为跳过
                    log.warn("schema 收集跳过 {}: {}", source.getSourceName(), e.getMessage());
                }
            }
            if (before.equals(schema.asMap())) {
                log.info("schema 收集完成: {} 轮, {} 张表", round, schema.size());
                return schema;
            }
        }
        log.warn("schema 收集 {} 轮后仍未稳定，使用当前结果", maxRounds);
        return schema;
    }

    /**
     * 由目录补全 SQL 中引用但 schema 中没有的表；单表失败只记录
     */
    public SchemaResolution fillFromCatalog(SchemaContext schema, List<SqlSource> sources, Catalog catalog) {
        SchemaResolution resolution = new SchemaResolution(schema);
        List<String> missing = new ArrayList<>(missingTables(schema, sources));
        if (missing.isEmpty()) {
            return resolution;
        }
        log.info("从目录 {} 获取 {} 张表的DDL", catalog.name(), missing.size());
        Map<String, String> ddls;
        try {
            ddls = catalog.getDdlBatch(missing);
        } catch (CatalogException e) {
            log.warn("目录 {} 批量获取失败: {}", catalog.name(), e.getMessage());
            for (String table : missing) {
                resolution.addFailure(table, e.getMessage());
            }
            return resolution;
        }
        DbType dbType = sources.isEmpty() ? null : sources.get(0).getDbType();
        for (String table : missing) {
            String ddl = ddls.get(table);
            if (ddl == null || ddl.startsWith(Catalog.ERROR_PREFIX)) {
                String reason = ddl == null ? "目录未返回DDL" : ddl.substring(Catalog.ERROR_PREFIX.length());
                log.warn("无法获取 {} 的DDL: {}", table, reason);
                resolution.addFailure(table, reason);
                continue;
            }
            try {
                List<String> columns = DdlSchemaParser.parseColumns(ddl, dbType);
                if (columns.isEmpty()) {
                    resolution.addFailure(table, "DDL 中没有列定义");
                } else if (schema.putIfAbsent(table, columns)) {
                    resolution.addCatalogTable(table);
                }
            } catch (SqlParseException e) {
                log.warn("{} 的DDL无法解析: {}", table, e.getMessage());
                resolution.addFailure(table, e.getMessage());
            }
        }
        return resolution;
    }

    private TreeSet<String> missingTables(SchemaContext schema, List<SqlSource> sources) {
        TreeSet<String> missing = new TreeSet<>();
        for (SqlSource source : sources) {
            ColumnLineageExtractor extractor;
            try {
                extractor = new ColumnLineageExtractor(source.getSql(), source.getDbType(), options, schema, tracer);
            } catch (SqlParseException e) {
                log.debug("{} 无法解析，不计入目录补全: {}", source.getSourceName(), e.getMessage());
                continue;
            }
            for (ParsedStatement statement : extractor.getStatements()) {
                for (TableName table : TableReferences.collect(statement).getTableNames()) {
                    if (!schema.contains(table.qualified())) {
                        missing.add(table.qualified());
                    }
                }
            }
        }
        return missing;
    }
}
