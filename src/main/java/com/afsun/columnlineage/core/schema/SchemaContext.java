package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.TableName;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 分析作用域内的已知表结构：表/视图标识 → 有序列名
 * 作用域为单个文件或一次构建，不做全局单例。
 * 语句分析完成后才登记该语句产生的表结构。
 *
 * @author afsun
 * @date 2025-11-05日 11:15
 */
@Slf4j
public class SchemaContext {

    private final Map<String, List<String>> tables = new LinkedHashMap<>();

    // 仅由列引用推断出来的表，允许继续补列
    private final Set<String> inferred = new HashSet<>();

    public static SchemaContext empty() {
        return new SchemaContext();
    }

    public static SchemaContext fromMap(Map<String, ? extends Collection<String>> schema) {
        SchemaContext ctx = new SchemaContext();
        if (schema != null) {
            for (Map.Entry<String, ? extends Collection<String>> e : schema.entrySet()) {
                ctx.tables.put(key(e.getKey()), lowerAll(e.getValue()));
            }
        }
        return ctx;
    }

    /**
     * 登记表的列（覆盖已有记录）
     */
    public void record(TableName table, List<String> columns) {
        String key = table.qualified();
        tables.put(key, lowerAll(columns));
        inferred.remove(key);
        log.debug("登记表结构: {} 列数={}", key, columns.size());
    }

    /**
     * 目录补全：已存在的记录优先
     *
     * @return 是否写入
     */
    public boolean putIfAbsent(String identifier, List<String> columns) {
        String key = key(identifier);
        if (tables.containsKey(key)) {
            return false;
        }
        tables.put(key, lowerAll(columns));
        return true;
    }

    /**
     * 由列引用推断出的列：只追加到尚未定义或同为推断的表
     */
    public void recordInferredColumn(TableName table, String column) {
        String key = table.qualified();
        List<String> columns = tables.get(key);
        if (columns == null) {
            columns = new ArrayList<>();
            tables.put(key, columns);
            inferred.add(key);
        } else if (!inferred.contains(key)) {
            return;
        }
        String col = column.toLowerCase(Locale.ROOT);
        if (!columns.contains(col)) {
            columns.add(col);
        }
    }

    /**
     * 合并另一份 schema，对方的记录覆盖本方
     */
    public void putAll(SchemaContext other) {
        for (Map.Entry<String, List<String>> e : other.tables.entrySet()) {
            tables.put(e.getKey(), new ArrayList<>(e.getValue()));
            if (other.inferred.contains(e.getKey())) {
                inferred.add(e.getKey());
            } else {
                inferred.remove(e.getKey());
            }
        }
    }

    /**
     * 查列：先精确匹配，未命中时按表名唯一匹配
     *
     * @return 列清单；未知时返回 null
     */
    public List<String> getColumns(String identifier) {
        String key = key(identifier);
        List<String> cols = tables.get(key);
        if (cols != null) {
            return Collections.unmodifiableList(cols);
        }
        TableName wanted = TableName.parse(key);
        String found = null;
        for (String candidate : tables.keySet()) {
            if (wanted.matches(candidate)) {
                if (found != null) {
                    return null;
                }
                found = candidate;
            }
        }
        return found == null ? null : Collections.unmodifiableList(tables.get(found));
    }

    public boolean contains(String identifier) {
        return getColumns(identifier) != null;
    }

    /**
     * 只保留当前语句引用到的表
     */
    public SchemaContext prune(Collection<TableName> referenced) {
        SchemaContext pruned = new SchemaContext();
        for (Map.Entry<String, List<String>> e : tables.entrySet()) {
            for (TableName t : referenced) {
                if (t.matches(e.getKey())) {
                    pruned.tables.put(e.getKey(), new ArrayList<>(e.getValue()));
                    break;
                }
            }
        }
        return pruned;
    }

    public SchemaContext copy() {
        SchemaContext copy = new SchemaContext();
        copy.putAll(this);
        return copy;
    }

    public Map<String, List<String>> asMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : tables.entrySet()) {
            map.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        return Collections.unmodifiableMap(map);
    }

    public Set<String> identifiers() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public int size() {
        return tables.size();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    private static String key(String identifier) {
        return TableName.parse(identifier).qualified();
    }

    private static List<String> lowerAll(Collection<String> columns) {
        List<String> out = new ArrayList<>();
        if (columns != null) {
            for (String c : columns) {
                out.add(TableName.normalize(c));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "SchemaContext" + tables;
    }
}
