package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.core.trace.DependencyNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * 图节点：一列（或字面量标记），记录首次出现的位置
 *
 * @author afsun
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String identifier;
    private String filePath;
    private int queryIndex;
    private String schemaName;
    private String table;
    private String column;

    /**
     * 按点号拆分标识：三段及以上为 schema/table/column（多余部分并入列名），两段为 table/column，
     * 一段只有列名。字面量标记不拆分。
     */
    public static GraphNode fromIdentifier(String identifier, String filePath, int queryIndex) {
        if (DependencyNode.isLiteralMarker(identifier)) {
            return new GraphNode(identifier, filePath, queryIndex, null, null, identifier);
        }
        String[] parts = identifier.split("\\.");
        if (parts.length >= 3) {
            String column = String.join(".", Arrays.asList(parts).subList(2, parts.length));
            return new GraphNode(identifier, filePath, queryIndex, parts[0], parts[1], column);
        }
        if (parts.length == 2) {
            return new GraphNode(identifier, filePath, queryIndex, null, parts[0], parts[1]);
        }
        return new GraphNode(identifier, filePath, queryIndex, null, null, identifier);
    }
}
