package com.afsun.columnlineage.service.impl;

import com.afsun.columnlineage.catalog.CatalogRegistry;
import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.exceptions.CatalogException;
import com.afsun.columnlineage.core.exceptions.InternalParseException;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.afsun.columnlineage.core.trace.DruidColumnLineageTracer;
import com.afsun.columnlineage.graph.LineageGraph;
import com.afsun.columnlineage.service.LineageQueryService;
import com.afsun.columnlineage.vo.AnalysisResult;
import com.afsun.columnlineage.vo.GraphBuildRequest;
import com.afsun.columnlineage.vo.GraphBuildResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class LineageAnalysisServiceImplTest {

    @TempDir
    Path dir;

    private LineageAnalysisServiceImpl service;
    private LineageProperties properties;
    private LineageQueryService queryService;

    @BeforeEach
    void setUp() {
        properties = new LineageProperties();
        properties.setGraphFile(dir.resolve("graph.json").toString());
        queryService = mock(LineageQueryService.class);
        service = service(new DruidColumnLineageTracer());
    }

    private LineageAnalysisServiceImpl service(ColumnLineageTracer tracer) {
        LineageAnalysisServiceImpl impl = new LineageAnalysisServiceImpl();
        ReflectionTestUtils.setField(impl, "properties", properties);
        ReflectionTestUtils.setField(impl, "tracer", tracer);
        ReflectionTestUtils.setField(impl, "catalogRegistry", new CatalogRegistry());
        ReflectionTestUtils.setField(impl, "lineageQueryService", queryService);
        ReflectionTestUtils.setField(impl, "clock",
                Clock.fixed(Instant.parse("2025-11-20T08:00:00Z"), ZoneOffset.UTC));
        return impl;
    }

    @Test
    void testAnalyze() {
        AnalysisResult result = service.analyze("INSERT INTO t2 SELECT a FROM t1", null,
                AnalysisLevel.COLUMN, null, null, null);

        assertTrue(result.getTraceId().startsWith("LN-"));
        assertEquals("mysql", result.getDialect());
        assertEquals(1, result.getQueries().size());
        assertTrue(result.getSkippedQueries().isEmpty());
    }

    @Test
    void testParseErrorIsNotWrapped() {
        assertThrows(SqlParseException.class, () -> service.analyze("THIS IS NOT SQL", "mysql",
                AnalysisLevel.COLUMN, null, null, null));
    }

    @Test
    void testUnexpectedErrorIsWrapped() {
        ColumnLineageTracer broken = mock(ColumnLineageTracer.class, invocation -> {
            throw new IllegalStateException("boom");
        });

        InternalParseException e = assertThrows(InternalParseException.class, () -> service(broken)
                .analyze("INSERT INTO t2 SELECT a FROM t1", "mysql", AnalysisLevel.COLUMN, null, null, null));

        assertTrue(e.getTraceId().startsWith("LN-"));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testExtractSchema() {
        Map<String, List<String>> schema = service.extractSchema(
                "CREATE TABLE orders (id INT, amount DECIMAL(10,2));", "mysql");

        assertEquals(Collections.singletonList("orders"), new ArrayList<>(schema.keySet()));
        assertEquals(Arrays.asList("id", "amount"), schema.get("orders"));
    }

    @Test
    void testBuildGraph() throws IOException {
        Path sql = dir.resolve("etl.sql");
        Files.write(sql, "INSERT INTO t2 SELECT a FROM t1;".getBytes(StandardCharsets.UTF_8));
        GraphBuildRequest request = new GraphBuildRequest();
        request.setPaths(Collections.singletonList(sql.toString()));

        GraphBuildResult result = service.buildGraph(request);

        assertTrue(Files.exists(dir.resolve("graph.json")));
        assertEquals(1, result.getMetadata().getTotalEdges());
        assertEquals("2025-11-20T08:00:00Z", result.getMetadata().getCreatedAt());
        assertTrue(result.getSkippedFiles().isEmpty());
        verify(queryService).reload(any(LineageGraph.class));
    }

    @Test
    void testBuildGraphRejectsEmptyPaths() {
        assertThrows(IllegalArgumentException.class, () -> service.buildGraph(new GraphBuildRequest()));
        verify(queryService, never()).reload(any());
    }

    @Test
    void testBuildGraphWithUnknownCatalog() {
        properties.getCatalog().setType("hive-metastore");
        GraphBuildRequest request = new GraphBuildRequest();
        request.setPaths(Collections.singletonList(dir.toString()));

        assertThrows(CatalogException.class, () -> service.buildGraph(request));
    }
}
