package com.afsun.columnlineage.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 边：sourceNode 的数据流入 targetNode
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {
    private String sourceNode;
    private String targetNode;
    private String filePath;
    private int queryIndex;
}
