package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.TableName;
import com.afsun.columnlineage.core.statement.*;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.statement.*;
import com.alibaba.druid.sql.visitor.SchemaStatVisitor;
import com.alibaba.druid.stat.TableStat;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 一条语句引用到的真实表（不含 CTE 名）、CTE 名以及列引用
 * 基于 Druid {@link SchemaStatVisitor} 统计
 *
 * @author afsun
 */
@Getter
public class TableReferences {

    private static final String UNKNOWN_TABLE = "UNKNOWN";

    private final Map<String, TableName> tables = new LinkedHashMap<>();
    private final Set<String> selectedTables = new LinkedHashSet<>();
    private final Set<String> cteNames = new LinkedHashSet<>();
    private final List<TableStat.Column> columns = new ArrayList<>();
    private final List<SQLSelectQueryBlock> blocks = new ArrayList<>();

    private TableReferences() {
    }

    public static TableReferences collect(ParsedStatement statement) {
        TableReferences refs = new TableReferences();
        if (statement instanceof WriteStatement) {
            refs.collectWith(((WriteStatement) statement).getWith());
        }
        for (SQLSelect select : statement.accept(new SourceSelects())) {
            refs.collectBlocks(select);
        }

        SchemaStatVisitor visitor = SQLUtils.createSchemaStatVisitor(statement.getDbType());
        statement.getAst().accept(visitor);
        for (Map.Entry<TableStat.Name, TableStat> e : visitor.getTables().entrySet()) {
            TableName tn = TableName.parse(e.getKey().getName());
            if (!tn.isQualified() && refs.cteNames.contains(tn.getTable())) {
                continue;
            }
            refs.tables.putIfAbsent(tn.qualified(), tn);
            if (e.getValue().getSelectCount() > 0) {
                refs.selectedTables.add(tn.qualified());
            }
        }
        TableName target = statement.getTarget();
        if (target != null) {
            refs.tables.putIfAbsent(target.qualified(), target);
        }
        refs.columns.addAll(visitor.getColumns());
        return refs;
    }

    public Collection<TableName> getTableNames() {
        return Collections.unmodifiableCollection(tables.values());
    }

    /**
     * 列引用所属的真实表，无法确定时返回 null
     */
    public TableName tableOf(TableStat.Column column) {
        String table = column.getTable();
        if (table == null || UNKNOWN_TABLE.equalsIgnoreCase(table)) {
            return null;
        }
        return tables.get(TableName.parse(table).qualified());
    }

    public boolean references(String filter) {
        String f = filter.toLowerCase(Locale.ROOT);
        for (String name : tables.keySet()) {
            if (name.contains(f)) {
                return true;
            }
        }
        return false;
    }

    private void collectBlocks(SQLSelect select) {
        if (select == null) {
            return;
        }
        collectWith(select.getWithSubQuery());
        for (SQLSelectQuery branch : SelectOutputResolver.branches(select.getQuery())) {
            if (branch instanceof SQLSelectQueryBlock) {
                SQLSelectQueryBlock block = (SQLSelectQueryBlock) branch;
                blocks.add(block);
                collectFrom(block.getFrom());
            }
        }
    }

    private void collectWith(SQLWithSubqueryClause with) {
        if (with == null) {
            return;
        }
        for (SQLWithSubqueryClause.Entry entry : with.getEntries()) {
            cteNames.add(TableName.normalize(entry.getAlias()));
            collectBlocks(entry.getSubQuery());
        }
    }

    private void collectFrom(SQLTableSource from) {
        if (from instanceof SQLJoinTableSource) {
            collectFrom(((SQLJoinTableSource) from).getLeft());
            collectFrom(((SQLJoinTableSource) from).getRight());
        } else if (from instanceof SQLSubqueryTableSource) {
            collectBlocks(((SQLSubqueryTableSource) from).getSelect());
        } else if (from instanceof SQLLateralViewTableSource) {
            collectFrom(((SQLLateralViewTableSource) from).getTableSource());
        }
    }

    /**
     * 语句中作为数据来源的查询
     */
    private static class SourceSelects implements ParsedStatement.Visitor<List<SQLSelect>> {

        @Override
        public List<SQLSelect> visitQuery(QueryStatement statement) {
            return Collections.singletonList(statement.getSelect());
        }

        @Override
        public List<SQLSelect> visitWrite(WriteStatement statement) {
            return Collections.singletonList(statement.getSelect());
        }

        @Override
        public List<SQLSelect> visitMerge(MergeStatement statement) {
            return subquery(statement.getMerge().getUsing());
        }

        @Override
        public List<SQLSelect> visitUpdate(UpdateStatement statement) {
            return subquery(statement.getUpdate().getFrom());
        }

        @Override
        public List<SQLSelect> visitDdl(DdlStatement statement) {
            return Collections.emptyList();
        }

        @Override
        public List<SQLSelect> visitUnsupported(UnsupportedStatement statement) {
            return Collections.emptyList();
        }

        private static List<SQLSelect> subquery(SQLTableSource source) {
            if (source instanceof SQLSubqueryTableSource) {
                return Collections.singletonList(((SQLSubqueryTableSource) source).getSelect());
            }
            return Collections.emptyList();
        }
    }
}
