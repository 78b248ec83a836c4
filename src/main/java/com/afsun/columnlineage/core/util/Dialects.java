package com.afsun.columnlineage.core.util;

import com.alibaba.druid.DbType;

import java.util.Locale;

/**
 * 方言标签到 Druid DbType 的映射
 */
public class Dialects {

    public static final String AUTO = "auto";

    private Dialects() {
    }

    /**
     * @param dialect 方言标签，null/空/auto 时按SQL内容探测
     * @param sql     用于探测的SQL文本
     */
    public static DbType resolve(String dialect, String sql) {
        if (dialect == null || dialect.trim().isEmpty() || AUTO.equalsIgnoreCase(dialect.trim())) {
            return SqlDialectDetector.detect(sql);
        }
        String tag = dialect.trim().toLowerCase(Locale.ROOT);
        switch (tag) {
            case "spark":
            case "sparksql":
            case "databricks":
                return DbType.hive;
            case "postgres":
                return DbType.postgresql;
            case "tsql":
                return DbType.sqlserver;
            default:
                DbType dbType = DbType.of(tag);
                if (dbType == null) {
                    throw new IllegalArgumentException("不支持的方言: " + dialect);
                }
                return dbType;
        }
    }

    /**
     * 仅 MySQL 系方言把 # 当作注释
     */
    public static boolean hashComments(DbType dbType) {
        return dbType == DbType.mysql || dbType == DbType.mariadb;
    }
}
