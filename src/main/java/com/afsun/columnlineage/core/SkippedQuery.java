package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 被跳过的语句及原因
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkippedQuery {
    private int queryIndex;
    private String statementType;
    private String reason;
    private String queryPreview;
}
