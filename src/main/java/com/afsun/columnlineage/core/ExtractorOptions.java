package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分析选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractorOptions {

    /**
     * 通配符无法展开时抛出 StarResolutionException 而不是输出 *
     */
    private boolean noStar;

    /**
     * schema 提取时，多表查询中的未限定列直接报错
     */
    private boolean strictSchema;

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(false, false);
    }
}
