package com.afsun.columnlineage.vo;

import com.afsun.columnlineage.core.SkippedQuery;
import com.afsun.columnlineage.graph.GraphMetadata;
import com.afsun.columnlineage.graph.SkippedFile;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class GraphBuildResult {
    private String traceId;
    private String outputFile;
    private GraphMetadata metadata;
    private List<SkippedFile> skippedFiles = new ArrayList<>();
    private Map<String, List<SkippedQuery>> skippedQueries = new LinkedHashMap<>();
    /**
     * 目录获取 DDL 失败的表 → 原因
     */
    private Map<String, String> failedTables = new LinkedHashMap<>();
    private long buildMillis;
}
