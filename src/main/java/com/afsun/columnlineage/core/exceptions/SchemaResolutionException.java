package com.afsun.columnlineage.core.exceptions;

/**
 * 严格 schema 模式下无法确定列归属
 */
public class SchemaResolutionException extends LineageException {

    public SchemaResolutionException(String message, String sqlFragment) {
        super("SCHEMA_UNRESOLVED", message, "请使用 t.col 形式限定列", sqlFragment);
    }
}
