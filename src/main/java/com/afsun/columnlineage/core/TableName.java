package com.afsun.columnlineage.core;

import com.alibaba.druid.sql.SQLUtils;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 规范化表名：去引号、小写，保留 catalog/schema/table 三段
 *
 * @author afsun
 * @date 2025-11-03日 11:52
 */
@Data
public class TableName {
    private final String catalog;
    private final String schema;
    private final String table;
    private final String original;

    private TableName(String catalog, String schema, String table, String original) {
        this.catalog = catalog;
        this.schema = schema;
        this.table = table;
        this.original = original;
    }

    public static TableName parse(String full) {
        String raw = full.trim();
        List<String> parts = new ArrayList<>();
        for (String p : raw.split("\\.")) {
            parts.add(normalize(p));
        }
        int n = parts.size();
        if (n >= 3) {
            // 多于三段时前面的部分并入 catalog
            String catalog = String.join(".", parts.subList(0, n - 2));
            return new TableName(catalog, parts.get(n - 2), parts.get(n - 1), raw);
        }
        if (n == 2) {
            return new TableName(null, parts.get(0), parts.get(1), raw);
        }
        return new TableName(null, null, parts.get(0), raw);
    }

    /**
     * 标识符规范化：去掉反引号/双引号/方括号并小写
     */
    public static String normalize(String identifier) {
        if (identifier == null) {
            return null;
        }
        return SQLUtils.normalize(identifier.trim()).toLowerCase(Locale.ROOT);
    }

    public boolean isQualified() {
        return schema != null;
    }

    /**
     * 限定名，例如 db.orders
     */
    public String qualified() {
        StringBuilder sb = new StringBuilder();
        if (catalog != null) sb.append(catalog).append(".");
        if (schema != null) sb.append(schema).append(".");
        sb.append(table);
        return sb.toString();
    }

    public String column(String column) {
        return qualified() + "." + column;
    }

    /**
     * 与给定标识符是否指同一张表：完整名相同，或一方未限定且表名相同
     */
    public boolean matches(String identifier) {
        if (identifier == null) {
            return false;
        }
        TableName other = parse(identifier);
        if (qualified().equals(other.qualified())) {
            return true;
        }
        return (!isQualified() || !other.isQualified()) && table.equals(other.table);
    }

    @Override
    public String toString() {
        return qualified();
    }
}
