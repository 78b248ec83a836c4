package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.expr.SQLAllColumnExpr;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.statement.*;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 计算查询的输出列并展开通配符
 * <p>
 * 裸 * 依次展开 FROM/JOIN 中每个可见来源（SEMI/ANTI JOIN 右侧除外），任一来源列未知则整体无法展开；
 * t.* 只展开指定来源。来源列的查找顺序：真实表查 {@link SchemaContext}，CTE/派生表递归计算其输出，
 * LATERAL VIEW 取其声明的列。UNION 取第一个分支的列。
 *
 * @author afsun
 */
@Slf4j
public class SelectOutputResolver {

    private static final int MAX_DEPTH = 32;

    private final SchemaContext schema;
    private final DbType dbType;

    public SelectOutputResolver(SchemaContext schema, DbType dbType) {
        this.schema = schema;
        this.dbType = dbType;
    }

    public List<SelectOutput> resolve(SQLSelect select, QueryScope outer) {
        return resolveQuery(select.getQuery(), QueryScope.enter(select, outer));
    }

    public List<SelectOutput> resolveQuery(SQLSelectQuery query, QueryScope scope) {
        return resolveQuery(query, scope, 0);
    }

    /**
     * UNION 的全部分支（左到右）
     */
    public static List<SQLSelectQuery> branches(SQLSelectQuery query) {
        List<SQLSelectQuery> out = new ArrayList<>();
        collectBranches(query, out);
        return out;
    }

    private static void collectBranches(SQLSelectQuery query, List<SQLSelectQuery> out) {
        if (query instanceof SQLUnionQuery) {
            SQLUnionQuery union = (SQLUnionQuery) query;
            collectBranches(union.getLeft(), out);
            collectBranches(union.getRight(), out);
        } else if (query != null) {
            out.add(query);
        }
    }

    private List<SelectOutput> resolveQuery(SQLSelectQuery query, QueryScope scope, int depth) {
        List<SelectOutput> outputs = new ArrayList<>();
        if (depth > MAX_DEPTH) {
            log.warn("查询嵌套超过{}层，停止展开", MAX_DEPTH);
            return outputs;
        }
        if (query instanceof SQLUnionQuery) {
            List<SQLSelectQuery> all = branches(query);
            return all.isEmpty() ? outputs : resolveQuery(all.get(0), scope, depth);
        }
        if (!(query instanceof SQLSelectQueryBlock)) {
            log.warn("不支持的查询结构: {}", query == null ? null : query.getClass().getSimpleName());
            return outputs;
        }
        SQLSelectQueryBlock block = (SQLSelectQueryBlock) query;
        QueryScope blockScope = bind(block, scope);

        for (SQLSelectItem item : block.getSelectList()) {
            SQLExpr expr = item.getExpr();
            String starOwner = starOwner(expr);
            if (starOwner != null) {
                expandStar(starOwner.isEmpty() ? null : starOwner, blockScope, outputs, depth);
                continue;
            }
            String alias = item.getAlias();
            if (alias != null && !alias.isEmpty()) {
                outputs.add(SelectOutput.expression(TableName.normalize(alias), expr, true, blockScope));
            } else {
                outputs.add(SelectOutput.expression(nameOf(expr), expr, false, blockScope));
            }
        }
        return outputs;
    }

    /**
     * 绑定查询块的 FROM，返回块作用域
     */
    public QueryScope bind(SQLSelectQueryBlock block, QueryScope scope) {
        QueryScope blockScope = scope.child();
        bindTableSource(block.getFrom(), blockScope, false);
        return blockScope;
    }

    public void bindTableSource(SQLTableSource from, QueryScope scope, boolean filterOnly) {
        if (from == null) {
            return;
        }

        if (from instanceof SQLExprTableSource) {
            SQLExprTableSource ts = (SQLExprTableSource) from;
            if (!(ts.getExpr() instanceof SQLName)) {
                log.debug("忽略表函数来源: {}", ts.getExpr());
                return;
            }
            TableName tn = TableName.parse(ts.getExpr().toString());
            String alias = ts.getAlias() == null ? tn.getTable() : TableName.normalize(ts.getAlias());
            QueryScope.CteDefinition cte = tn.isQualified() ? null : scope.findCte(tn.getTable());
            if (cte != null) {
                scope.addRelation(Relation.cte(ts.getAlias() == null ? cte.getName() : alias, cte, filterOnly));
            } else {
                scope.addRelation(Relation.table(alias, tn, filterOnly));
            }
            return;
        }

        if (from instanceof SQLJoinTableSource) {
            SQLJoinTableSource join = (SQLJoinTableSource) from;
            bindTableSource(join.getLeft(), scope, filterOnly);
            String joinType = join.getJoinType() == null ? "" : join.getJoinType().name();
            boolean filtering = joinType.contains("SEMI") || joinType.contains("ANTI");
            bindTableSource(join.getRight(), scope, filterOnly || filtering);
            return;
        }

        if (from instanceof SQLSubqueryTableSource) {
            SQLSubqueryTableSource sub = (SQLSubqueryTableSource) from;
            SQLSelect select = sub.getSelect();
            String alias = sub.getAlias() == null ? "_subquery" : TableName.normalize(sub.getAlias());
            scope.addRelation(Relation.subquery(alias, select.getQuery(),
                    QueryScope.enter(select, scope.getParent()), filterOnly));
            return;
        }

        if (from instanceof SQLUnionQueryTableSource) {
            SQLUnionQueryTableSource u = (SQLUnionQueryTableSource) from;
            String alias = u.getAlias() == null ? "_union" : TableName.normalize(u.getAlias());
            scope.addRelation(Relation.subquery(alias, u.getUnion(), scope.getParent(), filterOnly));
            return;
        }

        if (from instanceof SQLLateralViewTableSource) {
            SQLLateralViewTableSource lv = (SQLLateralViewTableSource) from;
            bindTableSource(lv.getTableSource(), scope, filterOnly);
            List<String> columns = new ArrayList<>();
            if (lv.getColumns() != null) {
                for (SQLName c : lv.getColumns()) {
                    columns.add(TableName.normalize(c.getSimpleName()));
                }
            }
            String alias = lv.getAlias() == null ? "_lateral" : TableName.normalize(lv.getAlias());
            scope.addRelation(Relation.lateral(alias, columns, lv.getMethod(), scope));
            return;
        }

        log.warn("FROM 子句结构暂不支持: {}", from.getClass().getSimpleName());
    }

    /**
     * 来源的列清单，未知时返回 null
     */
    public List<String> columnsOf(Relation relation) {
        return columnsOf(relation, 0);
    }

    private List<String> columnsOf(Relation relation, int depth) {
        switch (relation.getKind()) {
            case TABLE:
                return schema.getColumns(relation.getTable().qualified());
            case LATERAL:
                return relation.getDeclaredColumns();
            case CTE:
            case SUBQUERY:
            default:
                if (!relation.getDeclaredColumns().isEmpty()) {
                    return relation.getDeclaredColumns();
                }
                List<String> names = new ArrayList<>();
                for (SelectOutput out : resolveQuery(relation.getQuery(), relation.getQueryScope(), depth + 1)) {
                    if (out.isUnresolvedStar()) {
                        return null;
                    }
                    names.add(out.getName());
                }
                return names;
        }
    }

    /**
     * 派生来源中名为 column 的输出列在其查询中对应的名字（处理 CTE 声明列的改名）
     */
    public String innerName(Relation relation, String column) {
        List<String> declared = relation.getDeclaredColumns();
        if (relation.isDerived() && !declared.isEmpty()) {
            int idx = declared.indexOf(column);
            if (idx >= 0) {
                List<SelectOutput> inner = resolveQuery(relation.getQuery(), relation.getQueryScope(), 0);
                if (idx < inner.size()) {
                    return inner.get(idx).getName();
                }
            }
        }
        return column;
    }

    private void expandStar(String qualifier, QueryScope blockScope, List<SelectOutput> outputs, int depth) {
        List<SelectOutput> expanded = new ArrayList<>();
        if (qualifier == null) {
            boolean any = false;
            for (Relation r : blockScope.getRelations()) {
                if (r.isFilterOnly()) {
                    continue;
                }
                any = true;
                List<String> cols = columnsOf(r, depth);
                if (cols == null || cols.isEmpty()) {
                    log.debug("SELECT * 无法展开，来源列未知: {}", r);
                    outputs.add(SelectOutput.unresolved(null, blockScope));
                    return;
                }
                for (String c : cols) {
                    expanded.add(SelectOutput.star(c, r, blockScope));
                }
            }
            if (!any) {
                outputs.add(SelectOutput.unresolved(null, blockScope));
                return;
            }
        } else {
            Relation r = blockScope.resolve(qualifier);
            List<String> cols = r == null ? null : columnsOf(r, depth);
            if (cols == null || cols.isEmpty()) {
                log.debug("{}.* 无法展开", qualifier);
                outputs.add(SelectOutput.unresolved(TableName.normalize(qualifier), blockScope));
                return;
            }
            for (String c : cols) {
                expanded.add(SelectOutput.star(c, r, blockScope));
            }
        }
        outputs.addAll(expanded);
    }

    /**
     * 通配符的限定符：裸 * 返回空串，t.* 返回 t，非通配符返回 null
     */
    private static String starOwner(SQLExpr expr) {
        if (expr instanceof SQLAllColumnExpr) {
            SQLAllColumnExpr all = (SQLAllColumnExpr) expr;
            return all.getOwner() == null ? "" : all.getOwner().toString();
        }
        if (expr instanceof SQLPropertyExpr && "*".equals(((SQLPropertyExpr) expr).getName())) {
            return ((SQLPropertyExpr) expr).getOwner().toString();
        }
        return null;
    }

    /**
     * 无别名输出列的名字：列引用取列名，其余取表达式SQL
     */
    public String nameOf(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr) {
            return TableName.normalize(((SQLIdentifierExpr) expr).getName());
        }
        if (expr instanceof SQLPropertyExpr) {
            return TableName.normalize(((SQLPropertyExpr) expr).getName());
        }
        return SQLUtils.toSQLString(expr, dbType).trim().toLowerCase(Locale.ROOT);
    }

    public SchemaContext getSchema() {
        return schema;
    }

    public DbType getDbType() {
        return dbType;
    }
}
