package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.core.exceptions.ColumnNotFoundException;
import com.afsun.columnlineage.vo.LineageQueryResult;
import com.afsun.columnlineage.vo.LineageQueryResult.RelatedNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 血缘图的上下游查询
 * <p>
 * 距离为广度优先得到的最短跳数；路径为被查询节点与相关节点之间的全部简单路径，
 * 均按边的方向排列（上游：相关节点 → 被查询节点，下游：被查询节点 → 相关节点）。
 * root/leaf 为全图属性，与查询方向无关。
 *
 * @author afsun
 */
@Slf4j
public class LineageGraphQuerier {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> outgoing = new TreeMap<>();
    private final Map<String, List<String>> incoming = new TreeMap<>();

    public LineageGraphQuerier(LineageGraph graph) {
        for (GraphNode node : graph.getNodes()) {
            nodes.putIfAbsent(key(node.getIdentifier()), node);
        }
        for (GraphEdge edge : graph.getEdges()) {
            String source = key(edge.getSourceNode());
            String target = key(edge.getTargetNode());
            if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
                log.warn("忽略端点不存在的边: {} -> {}", edge.getSourceNode(), edge.getTargetNode());
                continue;
            }
            addAdjacent(outgoing, source, target);
            addAdjacent(incoming, target, source);
        }
        outgoing.values().forEach(Collections::sort);
        incoming.values().forEach(Collections::sort);
    }

    public static LineageGraphQuerier fromFile(Path path) throws IOException {
        return new LineageGraphQuerier(new LineageGraphSerializer().load(path));
    }

    /**
     * @throws ColumnNotFoundException 图中没有该列
     */
    public LineageQueryResult findUpstream(String column) {
        return findColumn(column, true);
    }

    /**
     * @throws ColumnNotFoundException 图中没有该列
     */
    public LineageQueryResult findDownstream(String column) {
        return findColumn(column, false);
    }

    /**
     * 表内全部列的上游汇总，不含该表自身的列
     *
     * @throws ColumnNotFoundException 图中没有该表的列
     */
    public LineageQueryResult findUpstreamTable(String table) {
        return findTable(table, true);
    }

    public LineageQueryResult findDownstreamTable(String table) {
        return findTable(table, false);
    }

    /**
     * 全部节点标识，按字母序（忽略大小写）
     */
    public List<String> listColumns() {
        List<String> ids = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            ids.add(node.getIdentifier());
        }
        ids.sort(String.CASE_INSENSITIVE_ORDER);
        return ids;
    }

    /**
     * 单段表名按节点的 table 匹配（跨 schema），多段按标识前缀匹配
     */
    public List<String> tableColumns(String table) {
        String wanted = table.toLowerCase(Locale.ROOT);
        boolean bare = !wanted.contains(".");
        List<String> matched = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            boolean hit = bare
                    ? node.getTable() != null && node.getTable().equalsIgnoreCase(wanted)
                    : key(node.getIdentifier()).startsWith(wanted + ".");
            if (hit) {
                matched.add(node.getIdentifier());
            }
        }
        matched.sort(String.CASE_INSENSITIVE_ORDER);
        return matched;
    }

    public boolean isRoot(String identifier) {
        return !incoming.containsKey(key(identifier));
    }

    public boolean isLeaf(String identifier) {
        return !outgoing.containsKey(key(identifier));
    }

    private LineageQueryResult findColumn(String column, boolean upstream) {
        long start = System.currentTimeMillis();
        GraphNode queried = nodes.get(key(column));
        if (queried == null) {
            throw new ColumnNotFoundException(listColumns(), "列 '{}' 不在血缘图中", column);
        }
        List<RelatedNode> related = related(queried, upstream, queried.getIdentifier());

        LineageQueryResult result = new LineageQueryResult();
        result.setQueryType(upstream ? "COLUMN_UPSTREAM" : "COLUMN_DOWNSTREAM");
        result.setDirection(upstream ? LineageQueryResult.UPSTREAM : LineageQueryResult.DOWNSTREAM);
        result.setSource(queried.getIdentifier());
        result.setQueriedColumns(Collections.singletonList(queried.getIdentifier()));
        result.setRelatedNodes(related);
        result.setQueryMillis(System.currentTimeMillis() - start);
        log.debug("查询{} {} 完成: {} 个节点", result.getDirection(), queried.getIdentifier(), related.size());
        return result;
    }

    private LineageQueryResult findTable(String table, boolean upstream) {
        long start = System.currentTimeMillis();
        List<String> columns = tableColumns(table);
        if (columns.isEmpty()) {
            Set<String> tables = new TreeSet<>();
            for (GraphNode node : nodes.values()) {
                if (node.getTable() != null) {
                    tables.add(node.getSchemaName() == null ? node.getTable()
                            : node.getSchemaName() + "." + node.getTable());
                }
            }
            throw new ColumnNotFoundException(tables, "表 '{}' 在血缘图中没有任何列", table);
        }
        Set<String> queriedKeys = new HashSet<>();
        for (String c : columns) {
            queriedKeys.add(key(c));
        }

        Map<String, RelatedNode> merged = new LinkedHashMap<>();
        for (String column : columns) {
            for (RelatedNode node : related(nodes.get(key(column)), upstream, table)) {
                String k = key(node.getIdentifier());
                if (queriedKeys.contains(k)) {
                    continue;
                }
                RelatedNode existing = merged.get(k);
                if (existing == null) {
                    merged.put(k, node);
                    continue;
                }
                existing.setHops(Math.min(existing.getHops(), node.getHops()));
                Set<List<String>> seen = new HashSet<>();
                for (LineagePath p : existing.getPaths()) {
                    seen.add(p.getNodes());
                }
                for (LineagePath p : node.getPaths()) {
                    if (seen.add(p.getNodes())) {
                        existing.getPaths().add(p);
                    }
                }
            }
        }
        List<RelatedNode> related = new ArrayList<>(merged.values());
        related.sort(Comparator.comparing(RelatedNode::getIdentifier, String.CASE_INSENSITIVE_ORDER));

        LineageQueryResult result = new LineageQueryResult();
        result.setQueryType(upstream ? "TABLE_UPSTREAM" : "TABLE_DOWNSTREAM");
        result.setDirection(upstream ? LineageQueryResult.UPSTREAM : LineageQueryResult.DOWNSTREAM);
        result.setSource(table);
        result.setQueriedColumns(columns);
        result.setRelatedNodes(related);
        result.setQueryMillis(System.currentTimeMillis() - start);
        return result;
    }

    private List<RelatedNode> related(GraphNode queried, boolean upstream, String outputColumn) {
        String start = key(queried.getIdentifier());
        Map<String, List<String>> adjacency = upstream ? incoming : outgoing;
        Map<String, Integer> hops = distances(start, adjacency);
        Map<String, List<LineagePath>> paths = allSimplePaths(start, adjacency, upstream);

        List<RelatedNode> related = new ArrayList<>();
        for (Map.Entry<String, Integer> e : hops.entrySet()) {
            String k = e.getKey();
            related.add(RelatedNode.of(nodes.get(k), e.getValue(), outputColumn, isRoot(k), isLeaf(k),
                    paths.getOrDefault(k, Collections.emptyList())));
        }
        related.sort(Comparator.comparing(RelatedNode::getIdentifier, String.CASE_INSENSITIVE_ORDER));
        return related;
    }

    /**
     * 广度优先最短跳数，不含起点
     */
    private static Map<String, Integer> distances(String start, Map<String, List<String>> adjacency) {
        Map<String, Integer> dist = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        dist.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, Collections.emptyList())) {
                if (!dist.containsKey(next)) {
                    dist.put(next, dist.get(current) + 1);
                    queue.add(next);
                }
            }
        }
        dist.remove(start);
        return dist;
    }

    /**
     * 从起点出发的全部简单路径，每个前缀即是到其末端节点的一条路径。显式栈实现。
     *
     * @param reverse 路径输出时是否反转（上游查询沿入边遍历）
     */
    private Map<String, List<LineagePath>> allSimplePaths(String start, Map<String, List<String>> adjacency,
                                                          boolean reverse) {
        Map<String, List<LineagePath>> result = new LinkedHashMap<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new LinkedHashSet<>();
        Deque<int[]> cursors = new ArrayDeque<>();
        path.add(start);
        onPath.add(start);
        cursors.push(new int[]{0});

        while (!cursors.isEmpty()) {
            String current = path.get(path.size() - 1);
            List<String> next = adjacency.getOrDefault(current, Collections.emptyList());
            int[] cursor = cursors.peek();
            if (cursor[0] >= next.size()) {
                cursors.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            String candidate = next.get(cursor[0]++);
            if (onPath.contains(candidate)) {
                continue;
            }
            path.add(candidate);
            onPath.add(candidate);
            cursors.push(new int[]{0});
            result.computeIfAbsent(candidate, k -> new ArrayList<>()).add(toPath(path, reverse));
        }
        return result;
    }

    private LineagePath toPath(List<String> keys, boolean reverse) {
        List<String> ids = new ArrayList<>(keys.size());
        for (String k : keys) {
            ids.add(nodes.get(k).getIdentifier());
        }
        if (reverse) {
            Collections.reverse(ids);
        }
        return new LineagePath(ids);
    }

    private static void addAdjacent(Map<String, List<String>> adjacency, String from, String to) {
        List<String> list = adjacency.computeIfAbsent(from, k -> new ArrayList<>());
        if (!list.contains(to)) {
            list.add(to);
        }
    }

    private static String key(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }
}
