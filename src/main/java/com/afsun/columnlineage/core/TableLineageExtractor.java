package com.afsun.columnlineage.core;

import com.afsun.columnlineage.core.exceptions.UnsupportedStatementException;
import com.afsun.columnlineage.core.schema.TableReferences;
import com.afsun.columnlineage.core.statement.ParsedStatement;
import com.afsun.columnlineage.core.statement.WriteStatement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * 表级血缘：目标表（查询语句为 query_result）依赖的输入表
 *
 * @author afsun
 */
public class TableLineageExtractor {

    public static final String QUERY_RESULT = "query_result";

    public List<LineageItem> extract(ParsedStatement statement) {
        return extract(statement, TableReferences.collect(statement));
    }

    public List<LineageItem> extract(ParsedStatement statement, TableReferences refs) {
        if (!statement.hasLineageBody()) {
            throw new UnsupportedStatementException(statement.getTypeName(), "语句没有表级血缘");
        }
        TableName target = statement.getTarget();
        String output = target == null ? QUERY_RESULT : target.qualified();

        TreeSet<String> inputs = new TreeSet<>();
        for (TableName tn : refs.getTableNames()) {
            String name = tn.qualified();
            if (target != null && name.equals(output) && !refs.getSelectedTables().contains(name)) {
                continue;
            }
            inputs.add(name);
        }
        List<LineageItem> items = new ArrayList<>();
        for (String input : inputs) {
            items.add(LineageItem.of(output, input));
        }
        return items;
    }

    /**
     * 语句中每张表的用途与对象类型，按名称排序
     */
    public List<TableInfo> tableInfos(ParsedStatement statement, TableReferences refs) {
        TableName target = statement.getTarget();
        List<TableInfo> infos = new ArrayList<>();
        for (TableName tn : refs.getTableNames()) {
            String name = tn.qualified();
            if (target != null && name.equals(target.qualified())) {
                TableInfo.Usage usage = refs.getSelectedTables().contains(name)
                        ? TableInfo.Usage.BOTH : TableInfo.Usage.OUTPUT;
                boolean view = statement instanceof WriteStatement && ((WriteStatement) statement).isView();
                infos.add(new TableInfo(name, usage, view ? TableInfo.ObjectType.VIEW : TableInfo.ObjectType.TABLE));
            } else {
                infos.add(new TableInfo(name, TableInfo.Usage.INPUT, TableInfo.ObjectType.UNKNOWN));
            }
        }
        for (String cte : refs.getCteNames()) {
            infos.add(new TableInfo(cte, TableInfo.Usage.INPUT, TableInfo.ObjectType.CTE));
        }
        infos.sort(Comparator.comparing(i -> i.getName().toLowerCase(Locale.ROOT)));
        return infos;
    }
}
