package com.afsun.columnlineage.config;

import com.afsun.columnlineage.catalog.CatalogRegistry;
import com.afsun.columnlineage.catalog.JdbcCatalog;
import com.afsun.columnlineage.core.trace.ColumnLineageTracer;
import com.afsun.columnlineage.core.trace.DruidColumnLineageTracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * @author afsun
 */
@Configuration
@Slf4j
public class LineageConfiguration {

    @Bean
    public ColumnLineageTracer columnLineageTracer() {
        return new DruidColumnLineageTracer();
    }

    /**
     * 存在数据源时注册 jdbc 目录
     */
    @Bean
    public CatalogRegistry catalogRegistry(ObjectProvider<JdbcTemplate> jdbcTemplate) {
        CatalogRegistry registry = new CatalogRegistry();
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template != null) {
            registry.register(JdbcCatalog.NAME, () -> new JdbcCatalog(template));
        }
        log.info("已注册目录: {}", registry.names());
        return registry;
    }

    @Bean
    public Clock lineageClock() {
        return Clock.systemUTC();
    }
}
