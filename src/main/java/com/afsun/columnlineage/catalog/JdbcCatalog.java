package com.afsun.columnlineage.catalog;

import com.afsun.columnlineage.core.TableName;
import com.afsun.columnlineage.core.exceptions.CatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 通过 JDBC 执行 SHOW CREATE TABLE 获取 DDL（MySQL、ClickHouse、Hive 等）
 * 结果取最后一列，兼容 MySQL 的 (Table, Create Table) 与 ClickHouse 的单列 statement。
 * <p>
 * 配置项：ddl-query，表名占位符为 {table}
 *
 * @author afsun
 */
@Slf4j
public class JdbcCatalog implements Catalog {

    public static final String NAME = "jdbc";
    public static final String DDL_QUERY_KEY = "ddl-query";
    public static final String DEFAULT_DDL_QUERY = "SHOW CREATE TABLE {table}";

    // 表名直接拼入SQL，只允许标识符字符
    private static final Pattern SAFE_TABLE = Pattern.compile("[A-Za-z0-9_$.`\"]+");

    private final JdbcTemplate jdbcTemplate;
    private String ddlQuery = DEFAULT_DDL_QUERY;

    public JdbcCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void configure(Map<String, String> config) {
        String query = config.get(DDL_QUERY_KEY);
        if (query != null) {
            if (!query.contains("{table}")) {
                throw new CatalogException(DDL_QUERY_KEY + " 缺少 {table} 占位符: " + query);
            }
            ddlQuery = query;
        }
    }

    @Override
    public String getDdl(String tableName) {
        if (tableName == null || !SAFE_TABLE.matcher(tableName).matches()) {
            throw new CatalogException("非法表名: " + tableName);
        }
        String sql = ddlQuery.replace("{table}", TableName.parse(tableName).getOriginal());
        log.debug("执行DDL查询: {}", sql);
        List<String> rows;
        try {
            rows = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString(rs.getMetaData().getColumnCount()));
        } catch (DataAccessException e) {
            throw new CatalogException("获取 " + tableName + " 的DDL失败: " + e.getMostSpecificCause().getMessage(), e);
        }
        if (rows.isEmpty() || rows.get(0) == null) {
            throw new CatalogException("目录中不存在表: " + tableName);
        }
        return rows.get(0);
    }
}
