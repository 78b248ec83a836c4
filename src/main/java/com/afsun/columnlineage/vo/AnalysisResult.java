package com.afsun.columnlineage.vo;

import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.QueryLineageResult;
import com.afsun.columnlineage.core.SkippedQuery;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次SQL文本分析的结果
 */
@Data
public class AnalysisResult {
    private String traceId;
    private String dialect;
    private AnalysisLevel level;
    private List<QueryLineageResult> queries = new ArrayList<>();
    private List<SkippedQuery> skippedQueries = new ArrayList<>();
    private long parseMillis;
}
