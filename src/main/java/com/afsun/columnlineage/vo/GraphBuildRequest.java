package com.afsun.columnlineage.vo;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建血缘图请求
 * paths 中可以是 SQL 文件、目录或 .csv 清单
 */
@Data
public class GraphBuildRequest {
    private List<String> paths = new ArrayList<>();
    private String dialect;
    private boolean recursive = true;
    private String glob = "*.sql";
    /**
     * 为空时使用配置中的方式
     */
    private Boolean resolveSchema;
    /**
     * 结果文件，为空时写入配置的 graph-file
     */
    private String output;
}
