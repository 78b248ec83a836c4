package com.afsun.columnlineage.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的小图
 */
final class GraphFixtures {

    private GraphFixtures() {
    }

    /**
     * @param edges 形如 "a->b"
     */
    static LineageGraph graph(String file, List<String> nodeIds, List<String> edges) {
        LineageGraph graph = new LineageGraph();
        List<GraphNode> nodes = new ArrayList<>();
        for (String id : nodeIds) {
            nodes.add(GraphNode.fromIdentifier(id, file, 0));
        }
        List<GraphEdge> edgeList = new ArrayList<>();
        for (String e : edges) {
            String[] ends = e.split("->");
            edgeList.add(new GraphEdge(ends[0].trim(), ends[1].trim(), file, 0));
        }
        graph.setNodes(nodes);
        graph.setEdges(edgeList);
        graph.getMetadata().setDefaultDialect("mysql");
        graph.getMetadata().getSourceFiles().add(file);
        graph.getMetadata().setTotalNodes(nodes.size());
        graph.getMetadata().setTotalEdges(edgeList.size());
        return graph;
    }

    static List<String> edgeStrings(LineageGraph graph) {
        List<String> out = new ArrayList<>();
        for (GraphEdge e : graph.getEdges()) {
            out.add(e.getSourceNode() + "->" + e.getTargetNode());
        }
        return out;
    }

    static List<String> nodeIds(LineageGraph graph) {
        List<String> out = new ArrayList<>();
        for (GraphNode n : graph.getNodes()) {
            out.add(n.getIdentifier());
        }
        return out;
    }
}
