package com.afsun.columnlineage.core.schema;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 构建前的 schema 解析结果
 */
@Getter
public class SchemaResolution {

    private final SchemaContext schema;
    /**
     * 由目录补全的表
     */
    private final List<String> catalogTables = new ArrayList<>();
    /**
     * 目录获取失败的表 → 原因
     */
    private final Map<String, String> failedTables = new LinkedHashMap<>();

    public SchemaResolution(SchemaContext schema) {
        this.schema = schema;
    }

    void addCatalogTable(String table) {
        catalogTables.add(table);
    }

    void addFailure(String table, String reason) {
        failedTables.put(table, reason);
    }
}
