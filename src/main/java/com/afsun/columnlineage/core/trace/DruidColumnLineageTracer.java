package com.afsun.columnlineage.core.trace;

import com.afsun.columnlineage.core.TableName;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.exceptions.UnsupportedStatementException;
import com.afsun.columnlineage.core.schema.QueryScope;
import com.afsun.columnlineage.core.schema.Relation;
import com.afsun.columnlineage.core.schema.SchemaContext;
import com.afsun.columnlineage.core.schema.SelectOutput;
import com.afsun.columnlineage.core.schema.SelectOutputResolver;
import com.afsun.columnlineage.core.statement.*;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.SQLOrderBy;
import com.alibaba.druid.sql.ast.SQLOver;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.*;
import com.alibaba.druid.sql.ast.statement.*;
import com.alibaba.druid.sql.parser.ParserException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 基于 Druid AST 的列血缘追溯
 * <p>
 * 从语句的查询主体中找到目标输出列，递归下探其表达式：列引用经别名解析到真实表（叶子 table.col），
 * 经 CTE/派生表时生成中间节点并继续下探；UNION 按位置对齐各分支；不含任何列引用的表达式
 * 生成字面量标记叶子。MERGE/UPDATE 以 SET/INSERT 赋值为输出。
 *
 * @author afsun
 */
@Slf4j
public class DruidColumnLineageTracer implements ColumnLineageTracer {

    public static final int MAX_DEPTH = 64;

    // 无括号的内置函数/常量，在部分方言中被解析为标识符
    private static final Set<String> NILADIC = new HashSet<>(Arrays.asList(
            "current_date", "current_time", "current_timestamp", "localtime", "localtimestamp",
            "current_user", "sysdate", "null", "true", "false"));

    @Override
    public DependencyNode trace(String column, String sql, DbType dbType, Map<String, List<String>> schema) {
        SQLStatement stmt = parseSingle(sql, dbType);
        ParsedStatement parsed = StatementClassifier.classify(0, sql, dbType, stmt);
        String wanted = column.trim().toLowerCase(Locale.ROOT);
        DependencyNode root = new DependencyNode(wanted);
        Walker walker = new Walker(new SelectOutputResolver(SchemaContext.fromMap(schema), dbType), dbType);
        parsed.accept(new TraceVisitor(walker, wanted, root));
        return root;
    }

    /**
     * 输出名与请求的列名是否一致；表达式列（如 'x'、sum(a)）按原文比较，标识符再按去引号后比较
     */
    static boolean sameColumn(String outputName, String column) {
        return outputName != null
                && (outputName.equals(column) || outputName.equals(TableName.normalize(column)));
    }

    private static SQLStatement parseSingle(String sql, DbType dbType) {
        List<SQLStatement> statements;
        try {
            statements = SQLUtils.parseStatements(sql, dbType);
        } catch (ParserException e) {
            throw new SqlParseException("语句解析失败: " + e.getMessage(), sql, e);
        }
        if (statements.isEmpty()) {
            throw new SqlParseException("没有可解析的语句");
        }
        return statements.get(0);
    }

    /**
     * 按语句类别选择追溯入口
     */
    private static class TraceVisitor implements ParsedStatement.Visitor<Void> {
        private final Walker walker;
        private final String column;
        private final DependencyNode root;

        TraceVisitor(Walker walker, String column, DependencyNode root) {
            this.walker = walker;
            this.column = column;
            this.root = root;
        }

        @Override
        public Void visitQuery(QueryStatement statement) {
            traceSelect(statement.getSelect(), QueryScope.root());
            return null;
        }

        @Override
        public Void visitWrite(WriteStatement statement) {
            traceSelect(statement.getSelect(), QueryScope.root(statement.getWith()));
            return null;
        }

        @Override
        public Void visitMerge(MergeStatement statement) {
            SQLMergeStatement merge = statement.getMerge();
            QueryScope scope = QueryScope.root().child();
            walker.resolver.bindTableSource(merge.getInto(), scope, false);
            walker.resolver.bindTableSource(merge.getUsing(), scope, false);

            SQLMergeStatement.MergeUpdateClause update = merge.getUpdateClause();
            if (update != null) {
                for (SQLUpdateSetItem item : update.getItems()) {
                    if (sameColumn(StatementClassifier.columnName(item.getColumn()), column)) {
                        walker.traceValue(item.getValue(), scope, root, 0);
                    }
                }
            }
            SQLMergeStatement.MergeInsertClause insert = merge.getInsertClause();
            if (insert != null) {
                List<SQLExpr> columns = insert.getColumns();
                List<SQLExpr> values = insert.getValues();
                for (int i = 0; i < columns.size() && i < values.size(); i++) {
                    if (sameColumn(StatementClassifier.columnName(columns.get(i)), column)) {
                        walker.traceValue(values.get(i), scope, root, 0);
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitUpdate(UpdateStatement statement) {
            SQLUpdateStatement update = statement.getUpdate();
            QueryScope scope = QueryScope.root().child();
            walker.resolver.bindTableSource(update.getTableSource(), scope, false);
            if (update.getFrom() != null) {
                walker.resolver.bindTableSource(update.getFrom(), scope, false);
            }
            for (SQLUpdateSetItem item : update.getItems()) {
                if (sameColumn(StatementClassifier.columnName(item.getColumn()), column)) {
                    walker.traceValue(item.getValue(), scope, root, 0);
                }
            }
            return null;
        }

        @Override
        public Void visitDdl(DdlStatement statement) {
            throw new UnsupportedStatementException(statement.getTypeName(), "建表语句没有查询主体");
        }

        @Override
        public Void visitUnsupported(UnsupportedStatement statement) {
            throw new UnsupportedStatementException(statement.getTypeName(), statement.getReason());
        }

        private void traceSelect(SQLSelect select, QueryScope outer) {
            walker.traceOutput(select.getQuery(), QueryScope.enter(select, outer), column, root, 0);
        }
    }

    /**
     * 表达式下探
     */
    private static class Walker {
        private final SelectOutputResolver resolver;
        private final DbType dbType;
        // 已追溯过的 (查询, 列) 及其子节点；同一 CTE 被多处引用时共享结果
        private final Map<SQLSelectQuery, Map<String, List<DependencyNode>>> traced = new IdentityHashMap<>();
        // 正在追溯的 (查询, 列)，再次遇到即为递归 CTE 的自引用
        private final Map<SQLSelectQuery, Set<String>> inProgress = new IdentityHashMap<>();

        Walker(SelectOutputResolver resolver, DbType dbType) {
            this.resolver = resolver;
            this.dbType = dbType;
        }

        void traceOutput(SQLSelectQuery query, QueryScope scope, String column, DependencyNode parent, int depth) {
            if (depth > MAX_DEPTH) {
                log.warn("列 {} 追溯超过{}层，截断", column, MAX_DEPTH);
                return;
            }
            List<SQLSelectQuery> branches = SelectOutputResolver.branches(query);
            if (branches.isEmpty()) {
                return;
            }
            List<SelectOutput> first = resolver.resolveQuery(branches.get(0), scope);
            int idx = indexOf(first, column);
            if (idx < 0) {
                log.debug("输出列 {} 不在查询输出中: {}", column, first);
                return;
            }
            traceSelectOutput(first.get(idx), parent, depth);
            // UNION 其余分支按位置对齐
            for (int i = 1; i < branches.size(); i++) {
                List<SelectOutput> outputs = resolver.resolveQuery(branches.get(i), scope);
                if (idx < outputs.size()) {
                    traceSelectOutput(outputs.get(idx), parent, depth);
                } else {
                    log.warn("UNION 第{}个分支列数不足，无法对齐列 {}", i + 1, column);
                }
            }
        }

        void traceSelectOutput(SelectOutput out, DependencyNode parent, int depth) {
            if (out.isUnresolvedStar()) {
                parent.add(new DependencyNode(unresolvedStarName(out)));
                return;
            }
            if (out.isFromStar()) {
                traceRelationColumn(out.getOrigin(), out.getName(), parent, depth + 1);
                return;
            }
            traceValue(out.getExpr(), out.getScope(), parent, depth);
        }

        void traceValue(SQLExpr expr, QueryScope scope, DependencyNode parent, int depth) {
            int before = parent.getChildren().size();
            walk(expr, scope, parent, depth);
            if (parent.getChildren().size() == before) {
                parent.add(DependencyNode.literal(SQLUtils.toSQLString(expr, dbType).trim()));
            }
        }

        private String unresolvedStarName(SelectOutput out) {
            if (out.getStarQualifier() == null) {
                Collection<Relation> relations = out.getScope().getRelations();
                return relations.size() == 1 ? relations.iterator().next().lineageName() + ".*" : "*";
            }
            Relation r = out.getScope().resolve(out.getStarQualifier());
            return (r == null ? out.getStarQualifier() : r.lineageName()) + ".*";
        }

        private static int indexOf(List<SelectOutput> outputs, String column) {
            for (int i = 0; i < outputs.size(); i++) {
                if (sameColumn(outputs.get(i).getName(), column)) {
                    return i;
                }
            }
            return -1;
        }

        private void walk(SQLObject node, QueryScope scope, DependencyNode parent, int depth) {
            if (node == null) {
                return;
            }

            // 未限定列: col
            if (node instanceof SQLIdentifierExpr) {
                String name = TableName.normalize(((SQLIdentifierExpr) node).getName());
                if (!NILADIC.contains(name)) {
                    resolveColumn(null, name, scope, parent, depth);
                }
                return;
            }

            // 限定列: t.col
            if (node instanceof SQLPropertyExpr) {
                SQLPropertyExpr pe = (SQLPropertyExpr) node;
                if (!"*".equals(pe.getName())) {
                    String owner = pe.getOwner() == null ? null : pe.getOwner().toString();
                    resolveColumn(owner, TableName.normalize(pe.getName()), scope, parent, depth);
                }
                return;
            }

            if (node instanceof SQLAllColumnExpr || node instanceof SQLLiteralExpr
                    || node instanceof SQLVariantRefExpr || node instanceof SQLExistsExpr) {
                return;
            }

            // 聚合 SUM(col) / COUNT(*) [OVER (...)]，需在方法调用之前判断
            if (node instanceof SQLAggregateExpr) {
                SQLAggregateExpr ag = (SQLAggregateExpr) node;
                for (SQLExpr arg : ag.getArguments()) {
                    walk(arg, scope, parent, depth);
                }
                walkOver(ag.getOver(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLMethodInvokeExpr) {
                for (SQLExpr arg : ((SQLMethodInvokeExpr) node).getArguments()) {
                    walk(arg, scope, parent, depth);
                }
                return;
            }

            if (node instanceof SQLCaseExpr) {
                SQLCaseExpr c = (SQLCaseExpr) node;
                walk(c.getValueExpr(), scope, parent, depth);
                for (SQLCaseExpr.Item it : c.getItems()) {
                    walk(it.getConditionExpr(), scope, parent, depth);
                    walk(it.getValueExpr(), scope, parent, depth);
                }
                walk(c.getElseExpr(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLBinaryOpExpr) {
                walk(((SQLBinaryOpExpr) node).getLeft(), scope, parent, depth);
                walk(((SQLBinaryOpExpr) node).getRight(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLUnaryExpr) {
                walk(((SQLUnaryExpr) node).getExpr(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLNotExpr) {
                walk(((SQLNotExpr) node).getExpr(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLCastExpr) {
                walk(((SQLCastExpr) node).getExpr(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLBetweenExpr) {
                SQLBetweenExpr be = (SQLBetweenExpr) node;
                walk(be.getTestExpr(), scope, parent, depth);
                walk(be.getBeginExpr(), scope, parent, depth);
                walk(be.getEndExpr(), scope, parent, depth);
                return;
            }

            if (node instanceof SQLInListExpr) {
                SQLInListExpr in = (SQLInListExpr) node;
                walk(in.getExpr(), scope, parent, depth);
                for (SQLExpr e : in.getTargetList()) {
                    walk(e, scope, parent, depth);
                }
                return;
            }

            // x IN (SELECT ...)：子查询只做过滤
            if (node instanceof SQLInSubQueryExpr) {
                walk(((SQLInSubQueryExpr) node).getExpr(), scope, parent, depth);
                return;
            }

            // 标量子查询：追溯其唯一输出列
            if (node instanceof SQLQueryExpr) {
                SQLSelect sub = ((SQLQueryExpr) node).getSubQuery();
                if (sub != null) {
                    List<SelectOutput> outputs = resolver.resolveQuery(sub.getQuery(), QueryScope.enter(sub, scope));
                    if (!outputs.isEmpty()) {
                        traceSelectOutput(outputs.get(0), parent, depth + 1);
                    }
                }
                return;
            }

            // 其他表达式按子节点递归
            if (node instanceof SQLExpr) {
                for (SQLObject child : ((SQLExpr) node).getChildren()) {
                    if (child instanceof SQLExpr) {
                        walk(child, scope, parent, depth);
                    }
                }
                return;
            }
            log.debug("忽略表达式节点: {}", node.getClass().getSimpleName());
        }

        private void walkOver(SQLOver over, QueryScope scope, DependencyNode parent, int depth) {
            if (over == null) {
                return;
            }
            if (over.getPartitionBy() != null) {
                for (SQLExpr p : over.getPartitionBy()) {
                    walk(p, scope, parent, depth);
                }
            }
            SQLOrderBy ob = over.getOrderBy();
            if (ob != null && ob.getItems() != null) {
                for (SQLSelectOrderByItem i : ob.getItems()) {
                    walk(i.getExpr(), scope, parent, depth);
                }
            }
        }

        private void resolveColumn(String qualifier, String column, QueryScope scope, DependencyNode parent, int depth) {
            Relation relation;
            if (qualifier != null) {
                relation = scope.resolve(qualifier);
                if (relation == null) {
                    parent.add(new DependencyNode(TableName.parse(qualifier).qualified() + "." + column));
                    return;
                }
            } else {
                relation = resolveUnqualified(column, scope);
                if (relation == null) {
                    parent.add(new DependencyNode(column));
                    return;
                }
            }
            traceRelationColumn(relation, column, parent, depth + 1);
        }

        /**
         * 未限定列的归属：LATERAL 生成列优先，其次唯一来源，再次按已知列匹配；
         * 本层没有来源时向外层查找
         */
        private Relation resolveUnqualified(String column, QueryScope scope) {
            for (QueryScope s = scope; s != null; s = s.getParent()) {
                Collection<Relation> relations = s.getRelations();
                if (relations.isEmpty()) {
                    continue;
                }
                Relation single = null;
                int selectable = 0;
                for (Relation r : relations) {
                    if (r.getKind() == Relation.Kind.LATERAL) {
                        if (r.getDeclaredColumns().contains(column)) {
                            return r;
                        }
                    } else if (!r.isFilterOnly()) {
                        selectable++;
                        single = r;
                    }
                }
                if (selectable == 1) {
                    return single;
                }
                for (Relation r : relations) {
                    if (r.getKind() == Relation.Kind.LATERAL) {
                        continue;
                    }
                    List<String> cols = resolver.columnsOf(r);
                    if (cols != null && cols.contains(column)) {
                        return r;
                    }
                }
                return null;
            }
            return null;
        }

        private void traceRelationColumn(Relation relation, String column, DependencyNode parent, int depth) {
            if (depth > MAX_DEPTH) {
                log.warn("{}.{} 追溯超过{}层，截断", relation.lineageName(), column, MAX_DEPTH);
                parent.add(DependencyNode.truncated(relation.lineageName() + "." + column));
                return;
            }
            switch (relation.getKind()) {
                case TABLE:
                    parent.add(new DependencyNode(relation.getTable().column(column)));
                    return;
                case LATERAL:
                    if (relation.getDeclaredColumns().contains(column)) {
                        traceValue(relation.getLateralExpr(), relation.getOwnerScope(), parent, depth);
                    } else {
                        parent.add(new DependencyNode(relation.getAlias() + "." + column));
                    }
                    return;
                case CTE:
                case SUBQUERY:
                default:
                    traceDerived(relation, column, parent, depth);
            }
        }

        private void traceDerived(Relation relation, String column, DependencyNode parent, int depth) {
            String name = relation.getAlias() + "." + column;
            SQLSelectQuery query = relation.getQuery();
            String inner = resolver.innerName(relation, column);
            List<DependencyNode> done = traced.computeIfAbsent(query, q -> new HashMap<>()).get(inner);
            if (done != null) {
                parent.add(new DependencyNode(name)).addAll(done);
                return;
            }
            Set<String> active = inProgress.computeIfAbsent(query, q -> new HashSet<>());
            if (!active.add(inner)) {
                log.debug("{} 为递归引用，不再展开", name);
                parent.add(DependencyNode.cycle(name));
                return;
            }
            DependencyNode mid = parent.add(new DependencyNode(name));
            try {
                if (depth + 1 > MAX_DEPTH) {
                    log.warn("{} 追溯超过{}层，截断", name, MAX_DEPTH);
                    mid.add(DependencyNode.truncated(name));
                } else {
                    traceOutput(query, relation.getQueryScope(), inner, mid, depth + 1);
                }
            } finally {
                active.remove(inner);
            }
            traced.get(query).put(inner, new ArrayList<>(mid.getChildren()));
        }
    }
}
