package com.afsun.columnlineage.core.exceptions;

/**
 * 禁止通配符模式下 SELECT * / t.* 无法展开
 * 必须向上传播，不能被降级为跳过
 */
public class StarResolutionException extends LineageException {

    public StarResolutionException(String message, String sqlFragment) {
        super("STAR_UNRESOLVED", message,
                "先通过 CREATE TABLE/VIEW 或目录补全该表的列，或关闭 no-star 模式", sqlFragment);
    }
}
