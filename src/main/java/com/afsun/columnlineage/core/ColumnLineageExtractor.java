package com.afsun.columnlineage.core;

import com.afsun.columnlineage.core.exceptions.ColumnNotFoundException;
import com.afsun.columnlineage.core.exceptions.LineageException;
import com.afsun.columnlineage.core.exceptions.SchemaResolutionException;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.exceptions.StarResolutionException;
import com.afsun.columnlineage.core.exceptions.UnsupportedStatementException;
import com.afsun.columnlineage.core.schema.QueryScope;
import com.afsun.columnlineage.core.schema.Relation;
import com.afsun.columnlineage.core.schema.SchemaContext;
import com.afsun.columnlineage.core.schema.SelectOutput;
import com.afsun.columnlineage.core.schema.SelectOutputResolver;
import com.afsun.columnlineage.core.schema.TableReferences;
import com.afsun.columnlineage.core.statement.DdlStatement;
import com.afsun.columnlineage.core.statement.MergeStatement;
import com.afsun.columnlineage.core.statement.ParsedScript;
import com.afsun.columnlineage.core.statement.ParsedStatement;
import com.afsun.columnlineage.core.statement.QueryStatement;
import com.afsun.columnlineage.core.statement.StatementClassifier;
import com.afsun.columnlineage.core.statement.StatementParser;
import com.afsun.columnlineage.core.statement.UnsupportedStatement;
import com.afsun.columnlineage.core.statement.UpdateStatement;
import com.afsun.columnlineage.core.statement.WriteStatement;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.afsun.columnlineage.core.trace.DependencyNode;
import com.afsun.columnlineage.core.trace.DruidColumnLineageTracer;
import com.afsun.columnlineage.core.util.SqlScriptUtils;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.statement.SQLMergeStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.stat.TableStat;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单个SQL文本的列级血缘分析
 * <p>
 * 文本按语句顺序分析，前面 CREATE TABLE AS / CREATE VIEW / CREATE TABLE 登记的表结构
 * 对后续语句可见（{@link SchemaContext}）。每列的来源由 {@link ColumnLineageTracer} 给出，
 * 调用前按语句引用的表裁剪 schema。
 *
 * @author afsun
 * @date 2025-11-05日 14:20
 */
@Slf4j
public class ColumnLineageExtractor {

    private final String sql;
    private final DbType dbType;
    private final ExtractorOptions options;
    private final SchemaContext initialSchema;
    private final ColumnLineageTracer tracer;
    private final ParsedScript script;
    private final TableLineageExtractor tableExtractor = new TableLineageExtractor();
    private final List<SkippedQuery> skippedQueries = new ArrayList<>();

    private SchemaContext schema;

    public ColumnLineageExtractor(String sql, DbType dbType) {
        this(sql, dbType, ExtractorOptions.defaults(), null, new DruidColumnLineageTracer());
    }

    /**
     * @throws SqlParseException 文本中没有任何可解析的语句
     */
    public ColumnLineageExtractor(String sql, DbType dbType, ExtractorOptions options,
                                  SchemaContext initialSchema, ColumnLineageTracer tracer) {
        this.sql = sql;
        this.dbType = dbType;
        this.options = options == null ? ExtractorOptions.defaults() : options;
        this.initialSchema = initialSchema == null ? SchemaContext.empty() : initialSchema.copy();
        this.tracer = tracer;
        this.script = StatementParser.parse(sql, dbType);
        if (script.isEmpty()) {
            RuntimeException first = script.getFirstError();
            if (first != null) {
                throw new SqlParseException("SQL解析失败: " + first.getMessage(),
                        SqlScriptUtils.preview(sql), first);
            }
            throw new SqlParseException("SQL文本中没有可分析的语句");
        }
        this.schema = this.initialSchema.copy();
    }

    public List<QueryLineageResult> analyzeQueries(AnalysisLevel level) {
        return analyzeQueries(level, null, null, null);
    }

    /**
     * 逐条语句分析血缘
     *
     * @param column       只返回该输出列（正向），可为 null
     * @param sourceColumn 只返回依赖该来源列的输出（反向），可为 null
     * @param tableFilter  只分析引用了名称包含该串的表的语句，可为 null
     * @throws ColumnNotFoundException  指定了 column/sourceColumn 但没有任何语句命中
     * @throws StarResolutionException  noStar 模式下通配符无法展开
     */
    public List<QueryLineageResult> analyzeQueries(AnalysisLevel level, String column, String sourceColumn,
                                                   String tableFilter) {
        if (column != null && sourceColumn != null) {
            throw new IllegalArgumentException("column 与 sourceColumn 不能同时指定");
        }
        long start = System.currentTimeMillis();
        schema = initialSchema.copy();
        skippedQueries.clear();
        skippedQueries.addAll(script.getFailures());

        List<QueryLineageResult> results = new ArrayList<>();
        Set<String> candidates = new TreeSet<>();
        for (ParsedStatement statement : script.getStatements()) {
            try {
                TableReferences refs = TableReferences.collect(statement);
                if (tableFilter != null && !refs.references(tableFilter)) {
                    continue;
                }
                List<LineageItem> items;
                if (level == AnalysisLevel.TABLE) {
                    items = tableExtractor.extract(statement, refs);
                } else if (sourceColumn != null) {
                    items = reverse(statement, sourceColumn, refs, candidates);
                    if (items.isEmpty()) {
                        continue;
                    }
                } else {
                    items = forward(statement, column, refs, candidates);
                    if (column != null && items.isEmpty()) {
                        continue;
                    }
                }
                results.add(new QueryLineageResult(statement.getIndex(), statement.getPreview(), level, items));
            } catch (UnsupportedStatementException e) {
                log.info("跳过第{}条语句 [{}]: {}", statement.getIndex(), e.getStatementType(), e.getMessage());
                skippedQueries.add(new SkippedQuery(statement.getIndex(), e.getStatementType(), e.getMessage(),
                        statement.getPreview()));
            } finally {
                recordSchema(statement);
            }
        }

        String wanted = column != null ? column : sourceColumn;
        if (wanted != null && results.isEmpty()) {
            throw new ColumnNotFoundException(candidates, "列 '{}' 在任何语句中都不存在", wanted);
        }
        log.info("血缘分析完成: level={}, 语句={}, 结果={}, 跳过={}, 耗时={}ms", level,
                script.getStatements().size(), results.size(), skippedQueries.size(),
                System.currentTimeMillis() - start);
        return results;
    }

    /**
     * 每条语句引用的表及其用途
     */
    public List<QueryTablesResult> analyzeTables(String tableFilter) {
        List<QueryTablesResult> results = new ArrayList<>();
        for (ParsedStatement statement : script.getStatements()) {
            TableReferences refs = TableReferences.collect(statement);
            if (tableFilter != null && !refs.references(tableFilter)) {
                continue;
            }
            results.add(new QueryTablesResult(statement.getIndex(), statement.getPreview(),
                    tableExtractor.tableInfos(statement, refs)));
        }
        return results;
    }

    /**
     * 只提取表结构，不追溯血缘
     * 登记 CREATE 语句定义的表，并从查询的列引用推断来源表的列。
     *
     * @throws SchemaResolutionException strictSchema 下多表查询存在未限定列
     */
    public SchemaContext extractSchemaOnly() {
        schema = initialSchema.copy();
        for (ParsedStatement statement : script.getStatements()) {
            if (statement.hasLineageBody()) {
                TableReferences refs = TableReferences.collect(statement);
                if (options.isStrictSchema()) {
                    checkQualified(statement, refs);
                }
                inferColumns(statement, refs);
            }
            recordSchema(statement);
        }
        log.debug("schema 提取完成: {} 张表", schema.size());
        return schema.copy();
    }

    /**
     * 语句的输出列，按出现顺序
     *
     * @throws StarResolutionException noStar 模式下通配符无法展开
     */
    public List<OutputColumn> getOutputColumns(ParsedStatement statement) {
        return statement.accept(new OutputColumns(statement));
    }

    public List<SkippedQuery> getSkippedQueries() {
        return Collections.unmodifiableList(skippedQueries);
    }

    /**
     * 分析过程中累积的表结构（初始 schema 加上文本中定义的表）
     */
    public SchemaContext getSchemaContext() {
        return schema;
    }

    public List<ParsedStatement> getStatements() {
        return Collections.unmodifiableList(script.getStatements());
    }

    public String getSql() {
        return sql;
    }

    public DbType getDbType() {
        return dbType;
    }

    private List<LineageItem> forward(ParsedStatement statement, String column, TableReferences refs,
                                      Set<String> candidates) {
        List<OutputColumn> outputs = getOutputColumns(statement);
        LinkedHashSet<LineageItem> items = new LinkedHashSet<>();
        TraceContext ctx = new TraceContext(statement, refs);
        for (OutputColumn out : outputs) {
            candidates.add(out.getQualifiedName());
            if (column != null && !out.matches(column)) {
                continue;
            }
            for (String source : ctx.sourcesOf(out)) {
                items.add(LineageItem.of(out.getQualifiedName(), source));
            }
        }
        return new ArrayList<>(items);
    }

    private List<LineageItem> reverse(ParsedStatement statement, String sourceColumn, TableReferences refs,
                                      Set<String> candidates) {
        String wanted = TableName.normalize(sourceColumn);
        List<OutputColumn> outputs = getOutputColumns(statement);
        LinkedHashSet<LineageItem> items = new LinkedHashSet<>();
        TraceContext ctx = new TraceContext(statement, refs);
        for (OutputColumn out : outputs) {
            candidates.add(out.getQualifiedName());
            for (String source : ctx.sourcesOf(out)) {
                candidates.add(source);
                if (source.equals(wanted)) {
                    // 反向结果中输出与来源互换
                    items.add(LineageItem.of(source, out.getQualifiedName()));
                }
            }
        }
        return new ArrayList<>(items);
    }

    /**
     * 当前语句的一次追溯：裁剪后的 schema 只计算一次
     */
    private class TraceContext {
        private final ParsedStatement statement;
        private final TableReferences refs;
        private Map<String, List<String>> pruned;

        TraceContext(ParsedStatement statement, TableReferences refs) {
            this.statement = statement;
            this.refs = refs;
        }

        List<String> sourcesOf(OutputColumn out) {
            if (out.isWildcard()) {
                return Collections.singletonList(out.getWildcardSource());
            }
            if (pruned == null) {
                pruned = schema.prune(refs.getTableNames()).asMap();
            }
            DependencyNode tree;
            try {
                tree = tracer.trace(out.getLineageName(), statement.getSql(), dbType, pruned);
            } catch (StarResolutionException | UnsupportedStatementException e) {
                throw e;
            } catch (LineageException e) {
                log.warn("列 {} 血缘追溯失败，跳过: {}", out.getQualifiedName(), e.getMessage());
                return Collections.emptyList();
            }
            List<String> leaves = tree.leafNames(DruidColumnLineageTracer.MAX_DEPTH);
            if (tree.hasTruncation(DruidColumnLineageTracer.MAX_DEPTH)) {
                log.warn("列 {} 追溯层级过深，部分来源被截断", out.getQualifiedName());
            }
            if (leaves.isEmpty()) {
                log.warn("列 {} 没有追溯到任何来源，跳过", out.getQualifiedName());
            }
            return leaves;
        }
    }

    private void recordSchema(ParsedStatement statement) {
        if (statement instanceof DdlStatement) {
            DdlStatement ddl = (DdlStatement) statement;
            schema.record(ddl.getTarget(), ddl.getColumns());
            return;
        }
        if (!(statement instanceof WriteStatement) || !((WriteStatement) statement).definesSchema()) {
            return;
        }
        WriteStatement write = (WriteStatement) statement;
        if (!write.getDeclaredColumns().isEmpty()) {
            schema.record(write.getTarget(), write.getDeclaredColumns());
            return;
        }
        List<String> columns = new ArrayList<>();
        QueryScope outer = QueryScope.root(write.getWith());
        for (SelectOutput out : new SelectOutputResolver(schema, dbType).resolve(write.getSelect(), outer)) {
            if (out.isUnresolvedStar()) {
                log.debug("{} 的通配符无法展开，不登记表结构", write.getTarget());
                return;
            }
            columns.add(out.getName());
        }
        schema.record(write.getTarget(), columns);
    }

    private void inferColumns(ParsedStatement statement, TableReferences refs) {
        TableName target = statement.getTarget();
        for (TableStat.Column column : refs.getColumns()) {
            TableName table = refs.tableOf(column);
            if (table == null || "*".equals(column.getName())) {
                continue;
            }
            if (target != null && target.qualified().equals(table.qualified())) {
                continue;
            }
            schema.recordInferredColumn(table, TableName.normalize(column.getName()));
        }
    }

    private void checkQualified(ParsedStatement statement, TableReferences refs) {
        SelectOutputResolver resolver = new SelectOutputResolver(schema, dbType);
        for (SQLSelectQueryBlock block : refs.getBlocks()) {
            QueryScope scope = resolver.bind(block, QueryScope.root());
            int selectable = 0;
            for (Relation r : scope.getRelations()) {
                if (r.getKind() != Relation.Kind.LATERAL && !r.isFilterOnly()) {
                    selectable++;
                }
            }
            if (selectable < 2) {
                continue;
            }
            for (SQLSelectItem item : block.getSelectList()) {
                String unqualified = findUnqualified(item.getExpr());
                if (unqualified != null) {
                    throw new SchemaResolutionException(
                            "多表查询中的未限定列 '" + unqualified + "' 无法确定所属表", statement.getPreview());
                }
            }
        }
    }

    private static String findUnqualified(SQLObject node) {
        if (node instanceof SQLIdentifierExpr) {
            return TableName.normalize(((SQLIdentifierExpr) node).getName());
        }
        if (node instanceof SQLPropertyExpr || node instanceof SQLQueryExpr || node == null) {
            return null;
        }
        if (node instanceof SQLExpr) {
            for (SQLObject child : ((SQLExpr) node).getChildren()) {
                String found = findUnqualified(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * 语句输出列的命名：
     * 写入语句为 target.col（显式列清单按位置覆盖）；查询语句中 t.col 取 t 的真实表名，
     * 单一来源的未限定列取该来源名，其余保持原名。
     */
    private class OutputColumns implements ParsedStatement.Visitor<List<OutputColumn>> {
        private final ParsedStatement statement;
        private final SelectOutputResolver resolver = new SelectOutputResolver(schema, dbType);

        OutputColumns(ParsedStatement statement) {
            this.statement = statement;
        }

        @Override
        public List<OutputColumn> visitQuery(QueryStatement query) {
            List<OutputColumn> columns = new ArrayList<>();
            for (SelectOutput out : resolver.resolve(query.getSelect(), QueryScope.root())) {
                if (out.isUnresolvedStar()) {
                    String source = wildcardSource(out);
                    columns.add(OutputColumn.wildcard(source, source));
                } else {
                    columns.add(OutputColumn.of(queryOutputName(out), out.getName()));
                }
            }
            return columns;
        }

        @Override
        public List<OutputColumn> visitWrite(WriteStatement write) {
            return writeColumns(write.getTarget(), write.getSelect(), QueryScope.root(write.getWith()),
                    write.getDeclaredColumns());
        }

        @Override
        public List<OutputColumn> visitMerge(MergeStatement merge) {
            Set<String> names = new LinkedHashSet<>();
            SQLMergeStatement ast = merge.getMerge();
            if (ast.getUpdateClause() != null) {
                for (SQLUpdateSetItem item : ast.getUpdateClause().getItems()) {
                    names.add(StatementClassifier.columnName(item.getColumn()));
                }
            }
            if (ast.getInsertClause() != null) {
                for (SQLExpr c : ast.getInsertClause().getColumns()) {
                    names.add(StatementClassifier.columnName(c));
                }
            }
            return targetColumns(merge.getTarget(), names);
        }

        @Override
        public List<OutputColumn> visitUpdate(UpdateStatement update) {
            Set<String> names = new LinkedHashSet<>();
            for (SQLUpdateSetItem item : update.getUpdate().getItems()) {
                names.add(StatementClassifier.columnName(item.getColumn()));
            }
            return targetColumns(update.getTarget(), names);
        }

        @Override
        public List<OutputColumn> visitDdl(DdlStatement ddl) {
            throw new UnsupportedStatementException(ddl.getTypeName(), "建表语句没有查询主体");
        }

        @Override
        public List<OutputColumn> visitUnsupported(UnsupportedStatement unsupported) {
            throw new UnsupportedStatementException(unsupported.getTypeName(), unsupported.getReason());
        }

        private List<OutputColumn> writeColumns(TableName target, SQLSelect select, QueryScope outer,
                                                List<String> declared) {
            List<OutputColumn> columns = new ArrayList<>();
            List<SelectOutput> outputs = resolver.resolve(select, outer);
            for (int i = 0; i < outputs.size(); i++) {
                SelectOutput out = outputs.get(i);
                if (out.isUnresolvedStar()) {
                    columns.add(OutputColumn.wildcard(target.column("*"), wildcardSource(out)));
                    continue;
                }
                String name = i < declared.size() ? declared.get(i) : out.getName();
                columns.add(OutputColumn.of(target.column(name), out.getName()));
            }
            if (!declared.isEmpty() && declared.size() != outputs.size()) {
                log.warn("{} 声明列数({})与查询输出列数({})不一致", target, declared.size(), outputs.size());
            }
            return columns;
        }

        private List<OutputColumn> targetColumns(TableName target, Set<String> names) {
            List<OutputColumn> columns = new ArrayList<>();
            for (String name : names) {
                if (name != null) {
                    columns.add(OutputColumn.of(target.column(name), name));
                }
            }
            return columns;
        }

        private String queryOutputName(SelectOutput out) {
            if (out.isFromStar()) {
                return out.getOrigin().lineageName() + "." + out.getName();
            }
            SQLExpr expr = out.getExpr();
            if (expr instanceof SQLPropertyExpr) {
                SQLPropertyExpr pe = (SQLPropertyExpr) expr;
                String owner = pe.getOwner() == null ? null : pe.getOwner().toString();
                if (owner != null) {
                    Relation r = out.getScope().resolve(owner);
                    String table = r == null ? TableName.parse(owner).qualified() : r.lineageName();
                    return table + "." + out.getName();
                }
            }
            if (expr instanceof SQLIdentifierExpr) {
                Relation single = singleSource(out.getScope());
                if (single != null) {
                    return single.lineageName() + "." + out.getName();
                }
            }
            return out.getName();
        }

        private Relation singleSource(QueryScope scope) {
            Relation found = null;
            for (Relation r : scope.getRelations()) {
                if (found != null) {
                    return null;
                }
                found = r;
            }
            return found;
        }

        private String wildcardSource(SelectOutput out) {
            if (options.isNoStar()) {
                String star = out.getStarQualifier() == null ? "*" : out.getStarQualifier() + ".*";
                throw new StarResolutionException("无法展开 " + star + "：来源表结构未知，请提供 schema",
                        statement.getPreview());
            }
            if (out.getStarQualifier() == null) {
                Relation single = singleSource(out.getScope());
                return single == null ? "*" : single.lineageName() + ".*";
            }
            Relation r = out.getScope().resolve(out.getStarQualifier());
            return (r == null ? out.getStarQualifier() : r.lineageName()) + ".*";
        }
    }
}
