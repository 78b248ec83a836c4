package com.afsun.columnlineage.vo;

import com.afsun.columnlineage.graph.GraphNode;
import com.afsun.columnlineage.graph.LineagePath;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 血缘查询结果
 *
 * @author afsun
 */
@Data
public class LineageQueryResult {

    public static final String UPSTREAM = "upstream";
    public static final String DOWNSTREAM = "downstream";

    /**
     * 查询类型：TABLE_UPSTREAM, TABLE_DOWNSTREAM, COLUMN_UPSTREAM, COLUMN_DOWNSTREAM
     */
    private String queryType;

    /**
     * 被查询的列或表（列为图中的原始标识）
     */
    private String source;

    /**
     * upstream 或 downstream
     */
    private String direction;

    /**
     * 实际参与查询的列，表级查询时为该表的全部列
     */
    private List<String> queriedColumns = new ArrayList<>();

    /**
     * 相关节点，按标识（忽略大小写）排序
     */
    private List<RelatedNode> relatedNodes = new ArrayList<>();

    /**
     * 查询耗时（毫秒）
     */
    private long queryMillis;

    public boolean isTableQuery() {
        return queryType != null && queryType.startsWith("TABLE_");
    }

    /**
     * 血缘相关节点
     */
    @Data
    public static class RelatedNode {
        private String identifier;
        private String filePath;
        private int queryIndex;
        private String schemaName;
        private String table;
        private String column;
        /**
         * 与被查询节点的最短距离
         */
        private int hops;
        private String outputColumn;
        /**
         * 没有入边
         */
        private boolean root;
        /**
         * 没有出边
         */
        private boolean leaf;
        private List<LineagePath> paths = new ArrayList<>();

        public static RelatedNode of(GraphNode node, int hops, String outputColumn, boolean root, boolean leaf,
                                     List<LineagePath> paths) {
            RelatedNode related = new RelatedNode();
            related.setIdentifier(node.getIdentifier());
            related.setFilePath(node.getFilePath());
            related.setQueryIndex(node.getQueryIndex());
            related.setSchemaName(node.getSchemaName());
            related.setTable(node.getTable());
            related.setColumn(node.getColumn());
            related.setHops(hops);
            related.setOutputColumn(outputColumn);
            related.setRoot(root);
            related.setLeaf(leaf);
            related.setPaths(new ArrayList<>(paths));
            return related;
        }
    }
}
