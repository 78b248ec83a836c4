package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.core.LineageItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * 构建与合并共用的去重规则：节点按标识（忽略大小写）首次出现为准，边按 (source, target) 去重
 */
class GraphAccumulator {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final TreeSet<String> sourceFiles = new TreeSet<>();

    void addItem(LineageItem item, String filePath, int queryIndex) {
        if (item.getSourceName() == null || item.getSourceName().isEmpty()) {
            return;
        }
        addNode(GraphNode.fromIdentifier(item.getSourceName(), filePath, queryIndex));
        addNode(GraphNode.fromIdentifier(item.getOutputName(), filePath, queryIndex));
        addEdge(new GraphEdge(item.getSourceName(), item.getOutputName(), filePath, queryIndex));
    }

    boolean addNode(GraphNode node) {
        return nodes.putIfAbsent(key(node.getIdentifier()), node) == null;
    }

    boolean hasNode(String identifier) {
        return nodes.containsKey(key(identifier));
    }

    /**
     * 端点不在图中的边被忽略
     */
    boolean addEdge(GraphEdge edge) {
        GraphNode source = nodes.get(key(edge.getSourceNode()));
        GraphNode target = nodes.get(key(edge.getTargetNode()));
        if (source == null || target == null) {
            return false;
        }
        String k = key(edge.getSourceNode()) + "\u0000" + key(edge.getTargetNode());
        if (edges.containsKey(k)) {
            return false;
        }
        edges.put(k, new GraphEdge(source.getIdentifier(), target.getIdentifier(),
                edge.getFilePath(), edge.getQueryIndex()));
        return true;
    }

    void addSourceFile(String file) {
        sourceFiles.add(file);
    }

    void addSourceFiles(List<String> files) {
        if (files != null) {
            sourceFiles.addAll(files);
        }
    }

    int nodeCount() {
        return nodes.size();
    }

    int edgeCount() {
        return edges.size();
    }

    /**
     * 节点按标识、边按 (source, target) 排序输出
     */
    LineageGraph toGraph(NodeFormat format, String dialect, String createdAt) {
        List<GraphNode> nodeList = new ArrayList<>(nodes.values());
        nodeList.sort(Comparator.comparing(n -> key(n.getIdentifier())));
        List<GraphEdge> edgeList = new ArrayList<>(edges.values());
        edgeList.sort(Comparator.comparing((GraphEdge e) -> key(e.getSourceNode()))
                .thenComparing(e -> key(e.getTargetNode())));
        GraphMetadata metadata = new GraphMetadata(format, dialect, createdAt,
                new ArrayList<>(sourceFiles), nodeList.size(), edgeList.size());
        return new LineageGraph(metadata, nodeList, edgeList);
    }

    private static String key(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }
}
