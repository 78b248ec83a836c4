package com.afsun.columnlineage.controller;

import com.afsun.columnlineage.config.LineageProperties;
import com.afsun.columnlineage.core.AnalysisLevel;
import com.afsun.columnlineage.core.exceptions.ColumnNotFoundException;
import com.afsun.columnlineage.core.exceptions.InternalParseException;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.exceptions.StarResolutionException;
import com.afsun.columnlineage.service.LineageAnalysisService;
import com.afsun.columnlineage.vo.AnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyzerSqlController.class)
class AnalyzerSqlControllerTest {

    private static final String SQL = "INSERT INTO t2 SELECT a FROM t1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LineageAnalysisService lineageAnalysisService;

    @MockBean
    private LineageProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getMaxFileSize()).thenReturn(1024L);
    }

    private static AnalysisResult result() {
        AnalysisResult result = new AnalysisResult();
        result.setTraceId("LN-1");
        result.setDialect("mysql");
        result.setLevel(AnalysisLevel.COLUMN);
        return result;
    }

    @Test
    void testParseText() throws Exception {
        when(lineageAnalysisService.analyze(eq(SQL), isNull(), eq(AnalysisLevel.COLUMN), isNull(), isNull(), isNull()))
                .thenReturn(result());

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("200"))
                .andExpect(jsonPath("$.data.traceId").value("LN-1"));
    }

    @Test
    void testParseTextPassesFilters() throws Exception {
        when(lineageAnalysisService.analyze(SQL, "hive", AnalysisLevel.TABLE, "t2.a", null, "t1"))
                .thenReturn(result());

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL)
                        .param("dialect", "hive").param("level", "TABLE")
                        .param("column", "t2.a").param("table", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dialect").value("mysql"));
    }

    @Test
    void testBlankTextIsRejected() throws Exception {
        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content("   "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("500"));
        verify(lineageAnalysisService, never()).analyze(any(), any(), any(), any(), any(), any());
    }

    @Test
    void testOversizeTextIsRejected() throws Exception {
        char[] big = new char[2048];
        Arrays.fill(big, 'x');

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(new String(big)))
                .andExpect(jsonPath("$.status").value("500"));
    }

    @Test
    void testUploadFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "etl.sql", "text/plain",
                SQL.getBytes(StandardCharsets.UTF_8));
        when(lineageAnalysisService.analyze(eq(SQL), eq("mysql"), eq(AnalysisLevel.COLUMN), isNull(), isNull(), isNull()))
                .thenReturn(result());

        mockMvc.perform(multipart("/sql/analyzer/upload").file(file).param("dialect", "mysql"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.traceId").value("LN-1"));
    }

    @Test
    void testEmptyUploadIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "etl.sql", "text/plain", new byte[0]);

        mockMvc.perform(multipart("/sql/analyzer/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("500"));
        verify(lineageAnalysisService, never()).analyze(any(), any(), any(), any(), any(), any());
    }

    @Test
    void testParseFailureIsBadRequest() throws Exception {
        when(lineageAnalysisService.analyze(anyString(), any(), any(), any(), any(), any()))
                .thenThrow(new SqlParseException("SQL解析失败: syntax error"));

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("PARSE_FAILURE"));
    }

    @Test
    void testUnknownColumnReturnsCandidates() throws Exception {
        when(lineageAnalysisService.analyze(anyString(), any(), any(), any(), any(), any()))
                .thenThrow(new ColumnNotFoundException(Arrays.asList("t2.a", "t2.b"), "列 '{}' 不存在", "t2.z"));

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL)
                        .param("column", "t2.z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.data[0]").value("t2.a"))
                .andExpect(jsonPath("$.data[1]").value("t2.b"));
    }

    @Test
    void testStarFailureIsUnprocessable() throws Exception {
        when(lineageAnalysisService.analyze(anyString(), any(), any(), any(), any(), any()))
                .thenThrow(new StarResolutionException("无法展开 t1.*", "SELECT * FROM t1"));

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("STAR_UNRESOLVED"));
    }

    @Test
    void testInternalErrorIsServerError() throws Exception {
        when(lineageAnalysisService.analyze(anyString(), any(), any(), any(), any(), any()))
                .thenThrow(new InternalParseException("boom", "LN-9", new IllegalStateException("boom")));

        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"));
    }

    @Test
    void testInvalidLevelIsBadRequest() throws Exception {
        mockMvc.perform(post("/sql/analyzer/parse").contentType(MediaType.TEXT_PLAIN).content(SQL)
                        .param("level", "ROW"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testExtractSchema() throws Exception {
        when(lineageAnalysisService.extractSchema("CREATE TABLE t (id INT)", null))
                .thenReturn(Collections.singletonMap("t", Collections.singletonList("id")));

        mockMvc.perform(post("/sql/analyzer/schema").contentType(MediaType.TEXT_PLAIN)
                        .content("CREATE TABLE t (id INT)"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.t[0]").value("id"));
    }
}
