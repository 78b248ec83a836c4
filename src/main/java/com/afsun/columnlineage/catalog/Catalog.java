package com.afsun.columnlineage.catalog;

import com.afsun.columnlineage.core.exceptions.CatalogException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 远程目录：按表名返回建表 DDL
 *
 * @author afsun
 */
public interface Catalog {

    /**
     * 批量结果中失败项的前缀
     */
    String ERROR_PREFIX = "ERROR: ";

    String name();

    /**
     * @throws CatalogException 表不存在或目录不可用
     */
    String getDdl(String tableName);

    /**
     * 逐表获取 DDL；单表失败不影响其余表，结果以 {@link #ERROR_PREFIX} 开头
     */
    default Map<String, String> getDdlBatch(List<String> tableNames) {
        Map<String, String> results = new LinkedHashMap<>();
        for (String table : tableNames) {
            try {
                results.put(table, getDdl(table));
            } catch (CatalogException e) {
                results.put(table, ERROR_PREFIX + e.getMessage());
            }
        }
        return results;
    }

    default void configure(Map<String, String> config) {
    }
}
