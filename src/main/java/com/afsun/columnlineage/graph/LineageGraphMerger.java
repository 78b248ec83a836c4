package com.afsun.columnlineage.graph;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 合并多个独立构建的血缘图，去重规则与构建时相同
 *
 * @author afsun
 */
@Slf4j
public class LineageGraphMerger {

    private final GraphAccumulator graph = new GraphAccumulator();
    private final LineageGraphSerializer serializer;
    private final Clock clock;
    private String defaultDialect;
    private int graphCount;

    public LineageGraphMerger() {
        this(new LineageGraphSerializer(), Clock.systemUTC());
    }

    public LineageGraphMerger(LineageGraphSerializer serializer, Clock clock) {
        this.serializer = serializer;
        this.clock = clock;
    }

    public LineageGraphMerger addGraph(LineageGraph lineageGraph) {
        if (defaultDialect == null && lineageGraph.getMetadata() != null) {
            defaultDialect = lineageGraph.getMetadata().getDefaultDialect();
        }
        if (lineageGraph.getMetadata() != null) {
            graph.addSourceFiles(lineageGraph.getMetadata().getSourceFiles());
        }
        for (GraphNode node : lineageGraph.getNodes()) {
            graph.addNode(node);
        }
        int dropped = 0;
        for (GraphEdge edge : lineageGraph.getEdges()) {
            if (graph.hasNode(edge.getSourceNode()) && graph.hasNode(edge.getTargetNode())) {
                graph.addEdge(edge);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("图中有 {} 条边的端点不存在，已忽略", dropped);
        }
        graphCount++;
        return this;
    }

    /**
     * @throws IOException 文件不存在或不是合法的血缘图 JSON
     */
    public LineageGraphMerger addFile(Path path) throws IOException {
        return addGraph(serializer.load(path));
    }

    public LineageGraphMerger addFiles(List<Path> paths) throws IOException {
        for (Path path : paths) {
            addFile(path);
        }
        return this;
    }

    public LineageGraph merge() {
        LineageGraph merged = graph.toGraph(NodeFormat.QUALIFIED, defaultDialect, Instant.now(clock).toString());
        log.info("合并 {} 个图: 节点={}, 边={}", graphCount, merged.getNodes().size(), merged.getEdges().size());
        return merged;
    }
}
