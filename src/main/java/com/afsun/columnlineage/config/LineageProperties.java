package com.afsun.columnlineage.config;

import com.afsun.columnlineage.core.ExtractorOptions;
import com.afsun.columnlineage.graph.NodeFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * sql.lineage.* 配置
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "sql.lineage")
public class LineageProperties {

    /**
     * 默认方言，auto 为按内容探测
     */
    private String dialect = "mysql";

    /**
     * 通配符无法展开时报错
     */
    private boolean noStar = false;

    private boolean strictSchema = false;

    private NodeFormat nodeFormat = NodeFormat.QUALIFIED;

    /**
     * 构建血缘图时先收集全部文件的表结构
     */
    private boolean resolveSchema = true;

    /**
     * 上传文件/SQL文本的大小上限（字节）
     */
    private long maxFileSize = 10 * 1024 * 1024;

    /**
     * 血缘图 JSON 文件，构建结果写入此处，查询接口从此处加载
     */
    private String graphFile = "lineage-graph.json";

    private Catalog catalog = new Catalog();

    @Data
    public static class Catalog {
        /**
         * 目录类型，如 jdbc；为空时不做目录补全
         */
        private String type;
        private Map<String, String> config = new LinkedHashMap<>();
    }

    public ExtractorOptions toExtractorOptions() {
        return ExtractorOptions.builder().noStar(noStar).strictSchema(strictSchema).build();
    }
}
