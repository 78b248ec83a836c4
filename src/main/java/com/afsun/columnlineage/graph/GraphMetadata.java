package com.afsun.columnlineage.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {
    private NodeFormat nodeFormat = NodeFormat.QUALIFIED;
    private String defaultDialect;
    /**
     * ISO-8601 UTC
     */
    private String createdAt;
    private List<String> sourceFiles = new ArrayList<>();
    private int totalNodes;
    private int totalEdges;
}
