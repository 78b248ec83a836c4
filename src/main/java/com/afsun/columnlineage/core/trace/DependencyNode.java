package com.afsun.columnlineage.core.trace;

import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 列依赖树节点。根为被追溯的输出列，叶子为来源列（table.col）或字面量标记
 *
 * @author afsun
 */
@Getter
public class DependencyNode {

    public static final String LITERAL_PREFIX = "<literal: ";

    /**
     * 节点类别。TRUNCATED 与 CYCLE 不是来源列，展平时不输出
     */
    public enum Kind {
        COLUMN,
        LITERAL,
        // 超过追溯深度被截断
        TRUNCATED,
        // 递归 CTE 对自身的引用
        CYCLE
    }

    private final String name;
    private final Kind kind;
    private final List<DependencyNode> children = new ArrayList<>();

    public DependencyNode(String name) {
        this(name, Kind.COLUMN);
    }

    private DependencyNode(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    public static DependencyNode literal(String sql) {
        return new DependencyNode(LITERAL_PREFIX + sql + ">", Kind.LITERAL);
    }

    public static DependencyNode truncated(String name) {
        return new DependencyNode(name, Kind.TRUNCATED);
    }

    public static DependencyNode cycle(String name) {
        return new DependencyNode(name, Kind.CYCLE);
    }

    public static boolean isLiteralMarker(String name) {
        return name != null && name.startsWith(LITERAL_PREFIX);
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public DependencyNode add(DependencyNode child) {
        children.add(child);
        return child;
    }

    /**
     * 追加已追溯过的子节点，子树在多个父节点间共享
     */
    void addAll(List<DependencyNode> shared) {
        children.addAll(shared);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public List<DependencyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 展平为去重排序的来源名称。使用显式栈遍历，共享子树只走一次；
     * 截断节点、递归自引用以及超过 maxDepth 的分支都不计为来源。
     * 根节点本身没有子节点时返回空列表。
     */
    public List<String> leafNames(int maxDepth) {
        TreeSet<String> leaves = new TreeSet<>();
        walk(maxDepth, leaves);
        return new ArrayList<>(leaves);
    }

    /**
     * 树中是否有被截断的分支（深度截断节点，或在 maxDepth 处仍有子节点）
     */
    public boolean hasTruncation(int maxDepth) {
        return walk(maxDepth, new TreeSet<>());
    }

    private boolean walk(int maxDepth, TreeSet<String> leaves) {
        boolean truncated = false;
        Set<DependencyNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<DependencyNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        for (DependencyNode child : children) {
            nodes.push(child);
            depths.push(1);
        }
        while (!nodes.isEmpty()) {
            DependencyNode node = nodes.pop();
            int depth = depths.pop();
            if (!seen.add(node) || node.kind == Kind.CYCLE) {
                continue;
            }
            if (node.kind == Kind.TRUNCATED) {
                truncated = true;
                continue;
            }
            if (node.isLeaf()) {
                leaves.add(node.name);
                continue;
            }
            if (depth >= maxDepth) {
                truncated = true;
                continue;
            }
            for (DependencyNode child : node.children) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return truncated;
    }

    @Override
    public String toString() {
        return children.isEmpty() ? name : name + children;
    }
}
