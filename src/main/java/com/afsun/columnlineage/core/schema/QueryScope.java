package com.afsun.columnlineage.core.schema;

import com.afsun.columnlineage.core.TableName;
import com.alibaba.druid.sql.ast.SQLName;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectQuery;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询块作用域：维护可见的 CTE 以及 FROM 中别名到来源的映射，支持逐层向外查找
 */
public class QueryScope {

    private final QueryScope parent;
    private final Map<String, CteDefinition> ctes = new LinkedHashMap<>();
    private final Map<String, Relation> relations = new LinkedHashMap<>();

    private QueryScope(QueryScope parent) {
        this.parent = parent;
    }

    public static QueryScope root() {
        return new QueryScope(null);
    }

    /**
     * 根作用域，并登记语句级 WITH 中的 CTE
     */
    public static QueryScope root(SQLWithSubqueryClause with) {
        QueryScope scope = root();
        if (with != null) {
            scope.registerWith(with);
        }
        return scope;
    }

    public QueryScope child() {
        return new QueryScope(this);
    }

    /**
     * 进入一个 SELECT：有 WITH 子句时建立新作用域并登记 CTE
     */
    public static QueryScope enter(SQLSelect select, QueryScope outer) {
        QueryScope base = outer == null ? root() : outer;
        if (select == null || select.getWithSubQuery() == null) {
            return base;
        }
        QueryScope scope = base.child();
        scope.registerWith(select.getWithSubQuery());
        return scope;
    }

    public void registerWith(SQLWithSubqueryClause with) {
        for (SQLWithSubqueryClause.Entry entry : with.getEntries()) {
            List<String> columns = new ArrayList<>();
            if (entry.getColumns() != null) {
                for (SQLName c : entry.getColumns()) {
                    columns.add(TableName.normalize(c.getSimpleName()));
                }
            }
            SQLSelect sub = entry.getSubQuery();
            String name = TableName.normalize(entry.getAlias());
            // CTE 可以引用同一 WITH 中的其他 CTE，因此在本作用域内求值
            ctes.put(name, new CteDefinition(name, sub.getQuery(), enter(sub, this), columns));
        }
    }

    public CteDefinition findCte(String name) {
        if (name == null) {
            return null;
        }
        String key = TableName.normalize(name);
        for (QueryScope s = this; s != null; s = s.parent) {
            CteDefinition def = s.ctes.get(key);
            if (def != null) {
                return def;
            }
        }
        return null;
    }

    public Collection<String> visibleCteNames() {
        List<String> names = new ArrayList<>();
        for (QueryScope s = this; s != null; s = s.parent) {
            names.addAll(s.ctes.keySet());
        }
        return names;
    }

    public void addRelation(Relation relation) {
        relations.put(relation.getAlias(), relation);
    }

    /**
     * 本层 FROM 绑定的来源（不含外层）
     */
    public Collection<Relation> getRelations() {
        return Collections.unmodifiableCollection(relations.values());
    }

    public QueryScope getParent() {
        return parent;
    }

    /**
     * 按别名/表名解析限定符，本层找不到时向外层查找（相关子查询）
     */
    public Relation resolve(String qualifier) {
        if (qualifier == null) {
            return null;
        }
        String key = TableName.normalize(qualifier);
        for (QueryScope s = this; s != null; s = s.parent) {
            Relation r = s.relations.get(key);
            if (r != null) {
                return r;
            }
            for (Relation candidate : s.relations.values()) {
                if (candidate.getKind() == Relation.Kind.TABLE && candidate.getTable().matches(key)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    @Getter
    public static class CteDefinition {
        private final String name;
        private final SQLSelectQuery query;
        private final QueryScope scope;
        private final List<String> columns;

        CteDefinition(String name, SQLSelectQuery query, QueryScope scope, List<String> columns) {
            this.name = name;
            this.query = query;
            this.scope = scope;
            this.columns = columns;
        }
    }
}
