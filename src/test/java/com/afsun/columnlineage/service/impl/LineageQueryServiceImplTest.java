package com.afsun.columnlineage.service.impl;

import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.exceptions.ColumnNotFoundException;
import com.afsun.columnlineage.core.exceptions.LineageException;
import com.afsun.columnlineage.graph.GraphEdge;
import com.afsun.columnlineage.graph.GraphNode;
import com.afsun.columnlineage.graph.LineageGraph;
import com.afsun.columnlineage.graph.LineageGraphSerializer;
import com.afsun.columnlineage.vo.LineageQueryResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class LineageQueryServiceImplTest {

    @TempDir
    Path dir;

    private LineageQueryServiceImpl service(Path graphFile) {
        LineageProperties properties = new LineageProperties();
        properties.setGraphFile(graphFile.toString());
        return new LineageQueryServiceImpl(properties);
    }

    private static LineageGraph chain() {
        LineageGraph graph = new LineageGraph();
        graph.setNodes(Arrays.asList(GraphNode.fromIdentifier("s.a", "x.sql", 0),
                GraphNode.fromIdentifier("t.b", "x.sql", 0)));
        graph.setEdges(Collections.singletonList(new GraphEdge("s.a", "t.b", "x.sql", 0)));
        return graph;
    }

    @Test
    void testMissingGraphFile() {
        LineageException e = assertThrows(LineageException.class,
                () -> service(dir.resolve("none.json")).queryUpstreamColumn("t.b"));

        assertEquals("GRAPH_NOT_FOUND", e.getErrorCode());
        assertNotNull(e.getSuggestion());
    }

    @Test
    void testInvalidGraphFile() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.write(file, "[1, 2".getBytes(StandardCharsets.UTF_8));

        LineageException e = assertThrows(LineageException.class, () -> service(file).listColumns());

        assertEquals("GRAPH_INVALID", e.getErrorCode());
    }

    @Test
    void testLoadsGraphFileOnFirstQuery() throws IOException {
        Path file = dir.resolve("graph.json");
        new LineageGraphSerializer().save(chain(), file);

        LineageQueryServiceImpl service = service(file);
        LineageQueryResult up = service.queryUpstreamColumn("T.B");

        assertEquals(1, up.getRelatedNodes().size());
        assertEquals("s.a", up.getRelatedNodes().get(0).getIdentifier());
        assertEquals(1, service.queryDownstreamTable("s").getRelatedNodes().size());
        assertThrows(ColumnNotFoundException.class, () -> service.queryDownstreamColumn("q.z"));
    }

    @Test
    void testReloadReplacesGraph() {
        LineageQueryServiceImpl service = service(dir.resolve("none.json"));

        service.reload(chain());

        assertEquals(Arrays.asList("s.a", "t.b"), service.listColumns());
        assertEquals("t.b", service.queryDownstreamColumn("s.a").getRelatedNodes().get(0).getIdentifier());
    }
}
