package com.afsun.columnlineage.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static com.afsun.columnlineage.graph.GraphFixtures.edgeStrings;
import static com.afsun.columnlineage.graph.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class LineageGraphSerializerTest {

    private final LineageGraphSerializer serializer = new LineageGraphSerializer();

    @Test
    void testSaveAndLoad(@TempDir Path dir) throws IOException {
        LineageGraph original = graph("one.sql", Arrays.asList("db.t.a", "db.t.b"),
                Collections.singletonList("db.t.a->db.t.b"));
        Path file = dir.resolve("out/graph.json");

        serializer.save(original, file);
        LineageGraph loaded = serializer.load(file);

        assertEquals(Collections.singletonList("db.t.a->db.t.b"), edgeStrings(loaded));
        GraphNode node = loaded.findNode("db.t.a");
        assertEquals("db", node.getSchemaName());
        assertEquals("t", node.getTable());
        assertEquals("a", node.getColumn());
        assertEquals("mysql", loaded.getMetadata().getDefaultDialect());
        assertEquals(NodeFormat.QUALIFIED, loaded.getMetadata().getNodeFormat());
    }

    @Test
    void testKeysAreSnakeCase() {
        String json = serializer.toJson(graph("one.sql", Arrays.asList("a", "b"), Collections.singletonList("a->b")));

        assertTrue(json.contains("\"source_node\""));
        assertTrue(json.contains("\"target_node\""));
        assertTrue(json.contains("\"query_index\""));
        assertTrue(json.contains("\"source_files\""));
        assertFalse(json.contains("sourceNode"));
    }

    @Test
    void testInvalidJsonFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.json");
        Files.write(file, "not a graph".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> serializer.load(file));
        assertThrows(IOException.class, () -> serializer.fromJson("{\"nodes\": null, \"edges\": []}"));
    }

    @Test
    void testUnknownKeysAreIgnored() throws IOException {
        LineageGraph graph = serializer.fromJson("{\"nodes\": [{\"identifier\": \"x\", \"extra\": 1}], \"edges\": []}");

        assertEquals("x", graph.getNodes().get(0).getIdentifier());
    }
}
