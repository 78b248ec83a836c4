package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.catalog.Catalog;
import com.afsun.columnlineage.core.ExtractorOptions;
import com.afsun.columnlineage.core.schema.SchemaContext;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.afsun.columnlineage.core.trace.DruidColumnLineageTracer;
import lombok.Builder;
import lombok.Data;

import java.time.Clock;

/**
 * 图构建选项
 */
@Data
@Builder
public class GraphBuildOptions {

    /**
     * 文件未指定方言时使用
     */
    @Builder.Default
    private String dialect = "mysql";

    @Builder.Default
    private NodeFormat nodeFormat = NodeFormat.QUALIFIED;

    private boolean noStar;

    private boolean strictSchema;

    /**
     * 先收集全部文件的表结构再分析
     */
    private boolean resolveSchema;

    /**
     * 两遍构建时补全缺失表结构，可为空
     */
    private Catalog catalog;

    private SchemaContext initialSchema;

    private SqlPreprocessor preprocessor;

    /**
     * 单个文件的字节上限，0 为不限制
     */
    private long maxFileSize;

    @Builder.Default
    private Clock clock = Clock.systemUTC();

    @Builder.Default
    private ColumnLineageTracer tracer = new DruidColumnLineageTracer();

    public ExtractorOptions toExtractorOptions() {
        return ExtractorOptions.builder().noStar(noStar).strictSchema(strictSchema).build();
    }
}
