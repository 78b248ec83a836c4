package com.afsun.columnlineage.core;

import lombok.Getter;

/**
 * 语句的一个输出列
 * qualifiedName 用于结果与图节点，lineageName 是传给血缘原语的列名
 */
@Getter
public class OutputColumn {

    private final String qualifiedName;
    private final String lineageName;
    private final boolean wildcard;
    /**
     * 未展开通配符的来源，如 db.t.*
     */
    private final String wildcardSource;

    private OutputColumn(String qualifiedName, String lineageName, boolean wildcard, String wildcardSource) {
        this.qualifiedName = qualifiedName;
        this.lineageName = lineageName;
        this.wildcard = wildcard;
        this.wildcardSource = wildcardSource;
    }

    public static OutputColumn of(String qualifiedName, String lineageName) {
        return new OutputColumn(qualifiedName, lineageName, false, null);
    }

    public static OutputColumn wildcard(String qualifiedName, String source) {
        return new OutputColumn(qualifiedName, "*", true, source);
    }

    /**
     * 按限定名或裸列名匹配（忽略大小写）
     */
    public boolean matches(String column) {
        return qualifiedName.equalsIgnoreCase(column) || lineageName.equalsIgnoreCase(column);
    }

    @Override
    public String toString() {
        return qualifiedName;
    }
}
