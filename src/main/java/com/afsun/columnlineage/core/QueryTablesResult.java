package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条语句的表清单
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryTablesResult {
    private int queryIndex;
    private String queryPreview;
    private List<TableInfo> tables = new ArrayList<>();
}
