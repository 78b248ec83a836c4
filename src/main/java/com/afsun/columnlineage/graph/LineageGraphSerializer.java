package com.afsun.columnlineage.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 血缘图 JSON 读写，键名使用 snake_case
 */
public class LineageGraphSerializer {

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String toJson(LineageGraph graph) {
        try {
            return mapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("血缘图序列化失败", e);
        }
    }

    public LineageGraph fromJson(String json) throws IOException {
        LineageGraph graph = mapper.readValue(json, LineageGraph.class);
        if (graph.getNodes() == null || graph.getEdges() == null) {
            throw new IOException("不是合法的血缘图: 缺少 nodes 或 edges");
        }
        return graph;
    }

    public void save(LineageGraph graph, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, toJson(graph).getBytes(StandardCharsets.UTF_8));
    }

    public LineageGraph load(Path path) throws IOException {
        return fromJson(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }
}
