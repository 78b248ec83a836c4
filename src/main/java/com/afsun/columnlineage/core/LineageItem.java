package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条血缘事实：输出列（或表）依赖某个来源列（或表、字面量标记）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineageItem {
    private String outputName;
    private String sourceName;

    public static LineageItem of(String outputName, String sourceName) {
        return new LineageItem(outputName, sourceName);
    }
}
