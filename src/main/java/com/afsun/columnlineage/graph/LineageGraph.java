package com.afsun.columnlineage.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 可序列化的完整血缘图
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineageGraph {

    private GraphMetadata metadata = new GraphMetadata();
    private List<GraphNode> nodes = new ArrayList<>();
    private List<GraphEdge> edges = new ArrayList<>();

    /**
     * 按标识查找节点（忽略大小写）
     *
     * @return 未找到时返回 null
     */
    public GraphNode findNode(String identifier) {
        for (GraphNode node : nodes) {
            if (node.getIdentifier().equalsIgnoreCase(identifier)) {
                return node;
            }
        }
        return null;
    }
}
