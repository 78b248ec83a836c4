package com.afsun.columnlineage.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ManifestTest {

    @Test
    void testParseWithQuotesAndEmptyDialect(@TempDir Path dir) throws IOException {
        Path csv = dir.resolve("m.csv");
        Files.write(csv, "dialect,FILE_PATH\n\"hive\",\"a.sql\"\n,b.sql\nmysql,\n".getBytes(StandardCharsets.UTF_8));

        Manifest manifest = Manifest.fromCsv(csv);

        assertEquals(2, manifest.getEntries().size());
        assertEquals("a.sql", manifest.getEntries().get(0).getFilePath());
        assertEquals("hive", manifest.getEntries().get(0).getDialect());
        assertNull(manifest.getEntries().get(1).getDialect());
    }

    @Test
    void testMissingPathColumn(@TempDir Path dir) throws IOException {
        Path csv = dir.resolve("m.csv");
        Files.write(csv, "name,dialect\na.sql,hive\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> Manifest.fromCsv(csv));
    }

    @Test
    void testQuotedPathWithComma(@TempDir Path dir) throws IOException {
        Path csv = dir.resolve("m.csv");
        Files.write(csv, ("file_path,dialect\n\"reports/q1,q2.sql\",hive\n\"say \"\"hi\"\".sql\",\n")
                .getBytes(StandardCharsets.UTF_8));

        Manifest manifest = Manifest.fromCsv(csv);

        assertEquals(2, manifest.getEntries().size());
        assertEquals("reports/q1,q2.sql", manifest.getEntries().get(0).getFilePath());
        assertEquals("hive", manifest.getEntries().get(0).getDialect());
        assertEquals("say \"hi\".sql", manifest.getEntries().get(1).getFilePath());
        assertNull(manifest.getEntries().get(1).getDialect());
    }

    @Test
    void testSplitRowKeepsEmptyCells() {
        assertArrayEquals(new String[]{"a", "", "c"}, Manifest.splitRow("a,,c"));
        assertArrayEquals(new String[]{"x,y", "z"}, Manifest.splitRow("\"x,y\" , z"));
    }
}
