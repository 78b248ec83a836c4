package com.afsun.columnlineage.controller.handler;

import com.afsun.columnlineage.core.exceptions.ColumnNotFoundException;
import com.afsun.columnlineage.core.exceptions.InternalParseException;
import com.afsun.columnlineage.core.exceptions.LineageException;
import com.afsun.columnlineage.core.exceptions.SchemaResolutionException;
import com.afsun.columnlineage.core.exceptions.SqlParseException;
import com.afsun.columnlineage.core.exceptions.StarResolutionException;
import com.afsun.columnlineage.core.exceptions.UnsupportedStatementException;
import com.afsun.columnlineage.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.List;

/**
 * 全局异常处理器
 * 统一处理SQL血缘分析过程中的各类异常，提供友好的错误响应
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 列或表不存在，data 中返回候选列表
     */
    @ExceptionHandler(ColumnNotFoundException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<List<String>> handleColumnNotFoundException(ColumnNotFoundException e) {
        log.warn("列不存在: {}", e.getMessage());
        return Response.fail(400, e.getErrorCode(), e.getMessage(), e.getCandidates());
    }

    @ExceptionHandler(SqlParseException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleSqlParseException(SqlParseException e) {
        log.warn("SQL解析失败: {}", e.getMessage());
        return Response.fail(400, e.getErrorCode(), "SQL解析失败: " + e.getMessage() +
                "\n建议：1) 检查SQL语法 2) 确认 dialect 参数与脚本方言一致", null);
    }

    /**
     * 不支持的语句、无法展开的通配符、无法确定归属的列
     */
    @ExceptionHandler({UnsupportedStatementException.class, StarResolutionException.class,
            SchemaResolutionException.class})
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Response<Void> handleUnprocessable(LineageException e) {
        log.warn("无法分析的SQL: {}", e.getMessage());
        return Response.fail(422, e.getErrorCode(), withSuggestion(e), null);
    }

    @ExceptionHandler(InternalParseException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleInternalParseException(InternalParseException e) {
        log.error("SQL分析内部错误, traceId={}", e.getTraceId(), e);
        return Response.fail(500, e.getErrorCode(), "分析失败: " + e.getMessage() +
                "\n这是一个内部错误，请联系技术支持并提供完整的SQL脚本", null);
    }

    @ExceptionHandler(LineageException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleLineageException(LineageException e) {
        log.warn("血缘分析失败: {}", e.getMessage());
        return Response.fail(400, e.getErrorCode(), withSuggestion(e), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Response<Void> handleMaxUploadSizeExceededException(MaxUploadSizeExceededException e) {
        log.warn("文件上传大小超限: {}", e.getMessage());
        return Response.fail(413, "文件大小超过限制，请上传较小的文件或使用文本接口");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(Exception e) {
        log.warn("非法参数: {}", e.getMessage());
        return Response.fail(400, "参数错误: " + e.getMessage());
    }

    /**
     * 处理其他未预期异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage() +
                "\n请联系技术支持");
    }

    private static String withSuggestion(LineageException e) {
        if (e.getSuggestion() == null) {
            return e.getMessage();
        }
        return e.getMessage() + "\n建议：" + e.getSuggestion();
    }
}
