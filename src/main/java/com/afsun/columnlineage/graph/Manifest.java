package com.afsun.columnlineage.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 构建清单：CSV，表头须含 file_path，可选 dialect 列
 * <pre>
 * file_path,dialect
 * staging/orders.sql,hive
 * marts/report.sql,
 * </pre>
 *
 * @author afsun
 */
@Getter
public class Manifest {

    private final List<Entry> entries = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String filePath;
        /**
         * 为空时使用构建的默认方言
         */
        private String dialect;
    }

    /**
     * @throws IOException              文件无法读取
     * @throws IllegalArgumentException 缺少 file_path 列
     */
    public static Manifest fromCsv(Path csv) throws IOException {
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("清单文件为空: " + csv);
        }
        List<String> header = new ArrayList<>();
        for (String cell : splitRow(lines.get(0).replace("\uFEFF", ""))) {
            header.add(cell.toLowerCase(Locale.ROOT));
        }
        int pathIdx = header.indexOf("file_path");
        int dialectIdx = header.indexOf("dialect");
        if (pathIdx < 0) {
            throw new IllegalArgumentException("清单缺少 file_path 列: " + csv);
        }
        Manifest manifest = new Manifest();
        for (String line : lines.subList(1, lines.size())) {
            String[] cells = splitRow(line);
            String path = pathIdx < cells.length ? cells[pathIdx] : "";
            if (path.isEmpty()) {
                continue;
            }
            String dialect = dialectIdx >= 0 && dialectIdx < cells.length ? cells[dialectIdx] : "";
            manifest.entries.add(new Entry(path, dialect.isEmpty() ? null : dialect));
        }
        return manifest;
    }

    /**
     * 按 CSV 规则切分一行：双引号内的逗号不切分，"" 为转义的引号
     */
    static String[] splitRow(String line) {
        if (StringUtils.isEmpty(line)) {
            return new String[0];
        }
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c != '"') {
                    cell.append(c);
                } else if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().trim());
        return cells.toArray(new String[0]);
    }
}
