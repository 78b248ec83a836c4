package com.afsun.columnlineage.controller;

import com.afsun.columnlineage.service.LineageAnalysisService;
import com.afsun.columnlineage.service.LineageQueryService;
import com.afsun.columnlineage.vo.GraphBuildRequest;
import com.afsun.columnlineage.vo.GraphBuildResult;
import com.afsun.columnlineage.vo.LineageQueryResult;
import com.afsun.columnlineage.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import javax.annotation.Resource;
import java.util.List;

/**
 * 血缘查询API控制器
 * 提供血缘图构建以及表级、列级血缘关系的查询接口
 *
 * @author afsun
 */
@RestController
@RequestMapping("/sql/lineage")
@Slf4j
public class LineageQueryController {

    @Resource
    private LineageQueryService lineageQueryService;

    @Resource
    private LineageAnalysisService lineageAnalysisService;

    /**
     * 构建血缘图并写入配置的图文件
     */
    @PostMapping("/graph/build")
    public Response<GraphBuildResult> buildGraph(@RequestBody GraphBuildRequest request) {
        log.info("构建血缘图: {}", request.getPaths());
        return Response.success(lineageAnalysisService.buildGraph(request));
    }

    /**
     * 查询列的上游依赖
     *
     * @param column 列标识，如 schema.table.column，忽略大小写
     */
    @GetMapping("/column/upstream")
    public Response<LineageQueryResult> queryUpstreamColumn(@RequestParam String column) {
        log.info("查询列上游依赖: {}", column);
        return Response.success(lineageQueryService.queryUpstreamColumn(column));
    }

    @GetMapping("/column/downstream")
    public Response<LineageQueryResult> queryDownstreamColumn(@RequestParam String column) {
        log.info("查询列下游依赖: {}", column);
        return Response.success(lineageQueryService.queryDownstreamColumn(column));
    }

    /**
     * 查询表的上游依赖，结果为表内各列上游的并集
     */
    @GetMapping("/table/upstream")
    public Response<LineageQueryResult> queryUpstreamTable(@RequestParam String table) {
        log.info("查询表上游依赖: {}", table);
        return Response.success(lineageQueryService.queryUpstreamTable(table));
    }

    @GetMapping("/table/downstream")
    public Response<LineageQueryResult> queryDownstreamTable(@RequestParam String table) {
        log.info("查询表下游依赖: {}", table);
        return Response.success(lineageQueryService.queryDownstreamTable(table));
    }

    @GetMapping("/columns")
    public Response<List<String>> listColumns() {
        return Response.success(lineageQueryService.listColumns());
    }
}
