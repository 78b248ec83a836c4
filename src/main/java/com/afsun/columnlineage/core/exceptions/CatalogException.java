package com.afsun.columnlineage.core.exceptions;

/**
 * 外部目录获取DDL失败
 * 单表失败在批量补全中只记录不终止
 */
public class CatalogException extends LineageException {

    public CatalogException(String message) {
        super("CATALOG_ERROR", message, "检查目录配置及表名");
    }

    public CatalogException(String message, Throwable cause) {
        super("CATALOG_ERROR", message, "检查目录配置及表名", null, cause);
    }
}
