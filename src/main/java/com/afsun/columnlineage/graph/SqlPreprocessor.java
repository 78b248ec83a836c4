package com.afsun.columnlineage.graph;

import java.nio.file.Path;

/**
 * 分析前对文件内容的处理（如模板渲染），由调用方提供
 */
@FunctionalInterface
public interface SqlPreprocessor {

    String process(String sql, Path file);
}
