package com.afsun.columnlineage.core.util;

import com.alibaba.druid.DbType;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * SQL方言检测器
 * 在未指定方言（或指定 auto）时根据SQL文本特征推断
 *
 * @author afsun
 */
@Slf4j
public class SqlDialectDetector {

    private SqlDialectDetector() {
    }

    /**
     * 检测SQL方言类型
     *
     * @param sql SQL文本
     * @return 检测到的方言类型，无明显特征时为 MySQL
     */
    public static DbType detect(String sql) {
        if (sql == null || sql.isEmpty()) {
            return DbType.mysql;
        }

        String s = sql.toLowerCase(Locale.ROOT);

        if (containsHiveFeatures(s)) {
            log.debug("检测到Hive/Spark方言特征");
            return DbType.hive;
        }
        if (containsClickHouseFeatures(s)) {
            log.debug("检测到ClickHouse方言特征");
            return DbType.clickhouse;
        }
        if (containsPostgreSQLFeatures(s)) {
            log.debug("检测到PostgreSQL方言特征");
            return DbType.postgresql;
        }
        if (containsOracleFeatures(s)) {
            log.debug("检测到Oracle方言特征");
            return DbType.oracle;
        }

        log.debug("使用默认MySQL方言");
        return DbType.mysql;
    }

    private static boolean containsHiveFeatures(String sql) {
        return sql.contains("lateral view")
                || sql.contains("left semi join")
                || sql.contains("left anti join")
                || sql.contains("insert overwrite table")
                || sql.contains("distribute by");
    }

    private static boolean containsClickHouseFeatures(String sql) {
        return sql.contains("engine =")
                || sql.contains("engine=")
                || sql.contains("prewhere");
    }

    private static boolean containsPostgreSQLFeatures(String sql) {
        return sql.contains("::")
                || sql.contains("generate_series")
                || (sql.contains("returning") && sql.contains("insert"));
    }

    private static boolean containsOracleFeatures(String sql) {
        return sql.contains(" dual")
                || sql.contains("sysdate")
                || sql.contains("rownum")
                || sql.contains("connect by");
    }
}
