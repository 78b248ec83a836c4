package com.afsun.columnlineage.graph;

import com.afsun.columnlineage.core.SkippedQuery;
import com.afsun.columnlineage.core.exceptions.StarResolutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LineageGraphBuilderTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-11-20T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private Path write(String name, String sql) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, sql.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static Set<String> edges(LineageGraph graph) {
        Set<String> edges = new HashSet<>();
        for (GraphEdge e : graph.getEdges()) {
            edges.add(e.getSourceNode() + " -> " + e.getTargetNode());
        }
        return edges;
    }

    private static LineageGraphBuilder builder(boolean resolveSchema) {
        return new LineageGraphBuilder(GraphBuildOptions.builder()
                .resolveSchema(resolveSchema)
                .clock(FIXED)
                .build());
    }

    @Test
    void testNodesAndEdgesAreDeduplicatedAcrossFiles() throws IOException {
        Path first = write("01_stage.sql", "INSERT INTO stg.orders SELECT id, amount FROM raw.orders");
        Path second = write("02_fact.sql", "INSERT INTO stg.orders SELECT id, amount FROM raw.orders;\n"
                + "INSERT INTO dw.fact SELECT id FROM stg.orders");

        LineageGraph graph = builder(false).addFiles(Arrays.asList(first, second), null).build();

        assertEquals(5, graph.getNodes().size());
        assertEquals(new HashSet<>(Arrays.asList(
                "raw.orders.id -> stg.orders.id",
                "raw.orders.amount -> stg.orders.amount",
                "stg.orders.id -> dw.fact.id")), edges(graph));
        GraphNode node = graph.findNode("RAW.ORDERS.ID");
        assertEquals(first.toAbsolutePath().normalize().toString(), node.getFilePath());
        assertEquals("raw", node.getSchemaName());
        assertEquals("orders", node.getTable());
        assertEquals("id", node.getColumn());
        assertEquals(2, graph.getMetadata().getSourceFiles().size());
        assertEquals(5, graph.getMetadata().getTotalNodes());
        assertEquals(3, graph.getMetadata().getTotalEdges());
        assertEquals("2025-11-20T08:00:00Z", graph.getMetadata().getCreatedAt());
    }

    @Test
    void testEveryEdgeEndpointIsANode() throws IOException {
        Path file = write("mix.sql", "INSERT INTO t2 (a, b) SELECT 'const', x FROM t1;\n"
                + "INSERT INTO t3 SELECT * FROM t2");

        LineageGraph graph = builder(false).addFile(file, null).build();

        Set<String> ids = new HashSet<>();
        for (GraphNode n : graph.getNodes()) {
            ids.add(n.getIdentifier().toLowerCase());
        }
        for (GraphEdge e : graph.getEdges()) {
            assertTrue(ids.contains(e.getSourceNode().toLowerCase()), e.getSourceNode());
            assertTrue(ids.contains(e.getTargetNode().toLowerCase()), e.getTargetNode());
        }
        assertTrue(edges(graph).contains("<literal: 'const'> -> t2.a"));
    }

    @Test
    void testTwoPassResolvesViewDefinedInLaterFile() throws IOException {
        Path report = write("a_report.sql", "INSERT INTO rpt SELECT * FROM v");
        Path view = write("b_view.sql", "CREATE VIEW v AS SELECT id, name FROM base");
        List<Path> files = Arrays.asList(report, view);

        LineageGraph resolved = builder(true).addFiles(files, null).build();
        assertTrue(edges(resolved).contains("v.id -> rpt.id"));
        assertTrue(edges(resolved).contains("v.name -> rpt.name"));
        assertFalse(edges(resolved).contains("v.* -> rpt.*"));

        LineageGraph single = builder(false).addFiles(files, null).build();
        assertTrue(edges(single).contains("v.* -> rpt.*"));
    }

    @Test
    void testUnreadableAndInvalidFilesAreSkipped() throws IOException {
        Path good = write("good.sql", "INSERT INTO t2 SELECT a FROM t1");
        Path bad = write("bad.sql", "THIS IS NOT SQL AT ALL");
        Path missing = dir.resolve("missing.sql");

        LineageGraphBuilder builder = builder(false);
        LineageGraph graph = builder.addFiles(Arrays.asList(good, bad, missing), null).build();

        assertEquals(1, graph.getEdges().size());
        assertEquals(2, builder.getSkippedFiles().size());
        assertEquals(1, graph.getMetadata().getSourceFiles().size());
    }

    @Test
    void testOversizedFileIsSkipped() throws IOException {
        Path big = write("big.sql", "INSERT INTO t2 SELECT a FROM t1");
        LineageGraphBuilder builder = new LineageGraphBuilder(GraphBuildOptions.builder().maxFileSize(5).build());

        LineageGraph graph = builder.addFile(big, null).build();

        assertTrue(graph.getNodes().isEmpty());
        assertEquals(1, builder.getSkippedFiles().size());
    }

    @Test
    void testSkippedStatementsAreReportedPerFile() throws IOException {
        Path file = write("maint.sql", "DELETE FROM t1 WHERE a IS NULL;\nINSERT INTO t2 SELECT a FROM t1");
        LineageGraphBuilder builder = builder(false);

        builder.addFile(file, null).build();

        List<SkippedQuery> skipped = builder.getSkippedQueries().get(file.toAbsolutePath().normalize().toString());
        assertNotNull(skipped);
        assertEquals(1, skipped.size());
        assertEquals(0, skipped.get(0).getQueryIndex());
    }

    @Test
    void testDirectoryRecursionAndGlob() throws IOException {
        write("top.sql", "INSERT INTO a2 SELECT x FROM a1");
        write("nested/deep.sql", "INSERT INTO b2 SELECT y FROM b1");
        write("notes.txt", "INSERT INTO c2 SELECT z FROM c1");

        LineageGraph flat = builder(false).addDirectory(dir, false, "*.sql", null).build();
        assertEquals(1, flat.getEdges().size());

        LineageGraph deep = builder(false).addDirectory(dir, true, "*.sql", null).build();
        assertEquals(new HashSet<>(Arrays.asList("a1.x -> a2.x", "b1.y -> b2.y")), edges(deep));
    }

    @Test
    void testManifestPathsRelativeToManifest() throws IOException {
        write("models/one.sql", "INSERT INTO m2 SELECT k FROM m1");
        write("models/two.sql", "INSERT INTO n2 SELECT v FROM n1");
        Path manifest = write("models/manifest.csv", "\uFEFFfile_path,dialect\none.sql,mysql\ntwo.sql,\n\n");

        LineageGraph graph = builder(false).addManifest(manifest, null).build();

        assertEquals(new HashSet<>(Arrays.asList("m1.k -> m2.k", "n1.v -> n2.v")), edges(graph));
    }

    @Test
    void testPreprocessorRunsBeforeAnalysis() throws IOException {
        Path file = write("tpl.sql", "INSERT INTO ${target} SELECT a FROM src");
        LineageGraphBuilder builder = new LineageGraphBuilder(GraphBuildOptions.builder()
                .preprocessor((sql, path) -> sql.replace("${target}", "dst"))
                .build());

        LineageGraph graph = builder.addFile(file, null).build();

        assertEquals(new HashSet<>(Arrays.asList("src.a -> dst.a")), edges(graph));
    }

    @Test
    void testSameInputsProduceIdenticalGraph() throws IOException {
        Path a = write("a.sql", "INSERT INTO t2 SELECT b, a FROM t1");
        Path b = write("b.sql", "INSERT INTO t3 SELECT a FROM t2");
        LineageGraphSerializer serializer = new LineageGraphSerializer();

        String first = serializer.toJson(builder(true).addFiles(Arrays.asList(a, b), null).build());
        String second = serializer.toJson(builder(true).addFiles(Arrays.asList(a, b), null).build());

        assertEquals(first, second);
    }

    @Test
    void testAddSqlUsesSourceName() {
        LineageGraph graph = builder(false).addSql("INSERT INTO t2 SELECT a FROM t1", "inline", "mysql").build();

        assertEquals("inline", graph.getEdges().get(0).getFilePath());
        assertEquals("mysql", graph.getMetadata().getDefaultDialect());
    }

    @Test
    void testNonTableWriteTargetDoesNotAbortBuild() {
        LineageGraphBuilder builder = builder(false)
                .addSql("INSERT INTO a SELECT x FROM s", "f1.sql", "mysql");

        assertDoesNotThrow(() -> builder
                .addSql("SELECT 1 FROM dual;\nUPDATE (SELECT x FROM s) v SET v.x = 1", "f2.sql", "oracle")
                .addSql("SELECT 1 FROM dual;\nMERGE INTO (SELECT * FROM t) x USING s ON (x.id = s.id) "
                        + "WHEN MATCHED THEN UPDATE SET x.x = s.x", "f3.sql", "oracle"));

        LineageGraph graph = builder.build();
        assertTrue(edges(graph).contains("s.x -> a.x"));
        assertTrue(builder.getSkippedFiles().isEmpty());
    }

    @Test
    void testUnionOfFilesMatchesMergedGraphs() throws IOException {
        Path a = write("p3/a.sql", "INSERT INTO t2 SELECT a, b FROM t1;\nINSERT INTO t3 SELECT a FROM t2");
        Path b = write("p3/b.sql", "INSERT INTO t4 SELECT a, 'x' AS c FROM t3;\nINSERT INTO t2 SELECT a, b FROM t0");

        LineageGraph forward = builder(false).addFiles(Arrays.asList(a, b), null).build();
        LineageGraph backward = builder(false).addFiles(Arrays.asList(b, a), null).build();
        LineageGraph merged = new LineageGraphMerger()
                .addGraph(builder(false).addFile(a, null).build())
                .addGraph(builder(false).addFile(b, null).build())
                .merge();

        assertEquals(edges(forward), edges(backward));
        assertEquals(edges(forward), edges(merged));
        assertEquals(nodeIds(forward), nodeIds(backward));
        assertEquals(nodeIds(forward), nodeIds(merged));
    }

    @Test
    void testNoStarFailureEscapesBuilder() {
        LineageGraphBuilder builder = new LineageGraphBuilder(GraphBuildOptions.builder().noStar(true).build());

        assertThrows(StarResolutionException.class,
                () -> builder.addSql("INSERT INTO t2 SELECT * FROM t1", "star.sql", "mysql"));
    }

    private static Set<String> nodeIds(LineageGraph graph) {
        Set<String> ids = new HashSet<>();
        for (GraphNode n : graph.getNodes()) {
            ids.add(n.getIdentifier());
        }
        return ids;
    }
}
