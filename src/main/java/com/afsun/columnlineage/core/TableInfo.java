package com.afsun.columnlineage.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 语句中引用到的一张表及其用途
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableInfo {

    public enum Usage {
        INPUT,
        OUTPUT,
        BOTH
    }

    public enum ObjectType {
        TABLE,
        VIEW,
        CTE,
        UNKNOWN
    }

    private String name;
    private Usage usage;
    private ObjectType objectType;
}
