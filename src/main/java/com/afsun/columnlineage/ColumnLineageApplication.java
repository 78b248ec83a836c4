package com.afsun.columnlineage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL列级血缘应用主类
 *
 * @author afsun
 * @date 2025-11-03日 16:02
 */
@SpringBootApplication(scanBasePackages = "com.afsun.columnlineage")
@ConfigurationPropertiesScan
public class ColumnLineageApplication {
    public static void main(String[] args) {
        SpringApplication.run(ColumnLineageApplication.class, args);
    }
}
