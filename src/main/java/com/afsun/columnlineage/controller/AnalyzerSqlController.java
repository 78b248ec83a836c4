package com.afsun.columnlineage.controller;


import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.QueryTablesResult;
import com.afsun.columnlineage.service.LineageAnalysisService;
import com.afsun.columnlineage.vo.AnalysisResult;
import com.afsun.columnlineage.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.Resource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * SQL血缘分析API控制器
 *
 * @author afsun
 * @date 2025-11-04日 8:55
 */
@RestController
@RequestMapping("/sql/analyzer")
@Slf4j
public class AnalyzerSqlController {

    @Resource
    private LineageAnalysisService lineageAnalysisService;

    @Resource
    private LineageProperties properties;

    /**
     * 通过上传文件分析SQL血缘关系
     *
     * @param file SQL脚本文件（UTF-8编码）
     */
    @PostMapping("/upload")
    public Response<AnalysisResult> parseFile(@RequestParam("file") MultipartFile file,
                                              @RequestParam(required = false) String dialect,
                                              @RequestParam(defaultValue = "COLUMN") AnalysisLevel level,
                                              @RequestParam(required = false) String column,
                                              @RequestParam(required = false) String sourceColumn,
                                              @RequestParam(required = false) String table) throws IOException {
        if (file == null || file.isEmpty()) {
            return Response.fail("文件不能为空");
        }
        long maxFileSize = properties.getMaxFileSize();
        if (file.getSize() > maxFileSize) {
            return Response.fail(String.format("文件大小超过限制：%.2fMB > %.2fMB",
                    file.getSize() / 1024.0 / 1024.0, maxFileSize / 1024.0 / 1024.0));
        }
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            return Response.fail("文件名无效");
        }

        log.info("开始分析SQL文件: {}, 大小: {} bytes", filename, file.getSize());
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        AnalysisResult result = lineageAnalysisService.analyze(content, dialect, level, column, sourceColumn, table);
        log.info("SQL文件分析成功: {}, traceId: {}, 耗时: {}ms", filename, result.getTraceId(), result.getParseMillis());
        return Response.success(result);
    }

    /**
     * 直接分析SQL文本
     *
     * @param column       正向：只返回该输出列的来源
     * @param sourceColumn 反向：返回依赖该来源列的输出列
     * @param table        只分析引用了该表的语句
     */
    @PostMapping("/parse")
    public Response<AnalysisResult> parseText(@RequestBody String sqlText,
                                              @RequestParam(required = false) String dialect,
                                              @RequestParam(defaultValue = "COLUMN") AnalysisLevel level,
                                              @RequestParam(required = false) String column,
                                              @RequestParam(required = false) String sourceColumn,
                                              @RequestParam(required = false) String table) {
        String invalid = validate(sqlText);
        if (invalid != null) {
            return Response.fail(invalid);
        }
        log.info("开始分析SQL文本，长度: {} 字符", sqlText.length());
        AnalysisResult result = lineageAnalysisService.analyze(sqlText, dialect, level, column, sourceColumn, table);
        log.info("SQL文本分析成功, traceId: {}, 耗时: {}ms", result.getTraceId(), result.getParseMillis());
        return Response.success(result);
    }

    /**
     * 每条语句的表级输入输出
     */
    @PostMapping("/tables")
    public Response<List<QueryTablesResult>> parseTables(@RequestBody String sqlText,
                                                         @RequestParam(required = false) String dialect,
                                                         @RequestParam(required = false) String table) {
        String invalid = validate(sqlText);
        if (invalid != null) {
            return Response.fail(invalid);
        }
        return Response.success(lineageAnalysisService.analyzeTables(sqlText, dialect, table));
    }

    /**
     * 从DDL及查询中提取表结构
     */
    @PostMapping("/schema")
    public Response<Map<String, List<String>>> extractSchema(@RequestBody String sqlText,
                                                             @RequestParam(required = false) String dialect) {
        String invalid = validate(sqlText);
        if (invalid != null) {
            return Response.fail(invalid);
        }
        return Response.success(lineageAnalysisService.extractSchema(sqlText, dialect));
    }

    private String validate(String sqlText) {
        if (sqlText == null || sqlText.trim().isEmpty()) {
            return "SQL文本不能为空";
        }
        if (sqlText.length() > properties.getMaxFileSize()) {
            return String.format("SQL文本长度超过限制：%d > %d", sqlText.length(), properties.getMaxFileSize());
        }
        return null;
    }
}
