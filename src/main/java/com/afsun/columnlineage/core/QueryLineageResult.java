package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条语句的血缘结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryLineageResult {
    private int queryIndex;
    private String queryPreview;
    private AnalysisLevel level;
    private List<LineageItem> items = new ArrayList<>();
}
