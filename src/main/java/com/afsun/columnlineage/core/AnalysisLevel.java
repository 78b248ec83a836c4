package com.afsun.columnlineage.core;

/**
 * 血缘粒度
 */
public enum AnalysisLevel {
    COLUMN,
    TABLE
}
