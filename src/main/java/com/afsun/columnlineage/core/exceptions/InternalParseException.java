package com.afsun.columnlineage.core.exceptions;

import lombok.Getter;

/**
 * 分析过程中出现的非预期错误，附带traceId便于排查
 *
 * @author afsun
 */
@Getter
public class InternalParseException extends LineageException {

    private final String traceId;

    public InternalParseException(String message, String traceId, Throwable cause) {
        super("INTERNAL_ERROR", message + " (traceId=" + traceId + ")", "请提供完整SQL脚本及traceId", null, cause);
        this.traceId = traceId;
    }
}
