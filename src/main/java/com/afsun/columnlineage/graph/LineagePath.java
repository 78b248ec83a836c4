package com.afsun.columnlineage.graph;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一条血缘路径，按边的方向排列
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineagePath {

    private List<String> nodes = new ArrayList<>();

    public int getHops() {
        return nodes.size() > 1 ? nodes.size() - 1 : 0;
    }

    public String toArrowString() {
        return String.join(" -> ", nodes);
    }
}
