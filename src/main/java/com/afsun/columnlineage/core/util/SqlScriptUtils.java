package com.afsun.columnlineage.core.util;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL脚本文本处理：去注释、按分号切分、生成预览
 *
 * @author afsun
 * @date 2025-11-11日 10:42
 */
public class SqlScriptUtils {

    private static final int PREVIEW_LENGTH = 100;

    private SqlScriptUtils() {
    }

    /**
     * 移除SQL中的注释（保留字符串字面量中的内容）
     * 支持：
     * - 单行注释：-- comment，以及 MySQL 的 # comment（hashComments=true 时）
     * - 多行注释：/* comment *\/
     *
     * @param sql          原始SQL文本
     * @param hashComments 是否把 # 视为单行注释
     * @return 移除注释后的SQL
     */
    public static String stripComments(String sql, boolean hashComments) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }

        StringBuilder result = new StringBuilder(sql.length());
        int len = sql.length();
        int i = 0;

        while (i < len) {
            char c = sql.charAt(i);

            // 字符串字面量与带引号标识符原样保留
            if (c == '\'' || c == '"' || c == '`') {
                i = copyQuoted(sql, i, result);
                continue;
            }

            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                i += 2;
                while (i < len && !(sql.charAt(i) == '*' && i + 1 < len && sql.charAt(i + 1) == '/')) {
                    i++;
                }
                i = Math.min(len, i + 2);
                result.append(' ');
                continue;
            }

            if ((c == '-' && i + 1 < len && sql.charAt(i + 1) == '-') || (hashComments && c == '#')) {
                while (i < len && sql.charAt(i) != '\n' && sql.charAt(i) != '\r') {
                    i++;
                }
                continue;
            }

            result.append(c);
            i++;
        }
        return result.toString().trim();
    }

    /**
     * 语句切分：以分号切分，引号内的分号不切，空语句丢弃
     */
    public static List<String> splitStatements(String text) {
        List<String> list = new ArrayList<>();
        if (text == null) {
            return list;
        }
        StringBuilder sb = new StringBuilder();
        int len = text.length();
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = copyQuoted(text, i, sb);
                continue;
            }
            if (c == ';') {
                addIfNotBlank(list, sb);
                sb.setLength(0);
            } else {
                sb.append(c);
            }
            i++;
        }
        addIfNotBlank(list, sb);
        return list;
    }

    /**
     * 语句预览：压缩空白，超过100字符截断并追加 ...
     */
    public static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= PREVIEW_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static void addIfNotBlank(List<String> list, StringBuilder sb) {
        String s = sb.toString().trim();
        if (!s.isEmpty()) {
            list.add(s);
        }
    }

    // 从 start 处的引号开始复制到配对引号之后，支持 '' 与反斜杠转义
    private static int copyQuoted(String sql, int start, StringBuilder out) {
        char quote = sql.charAt(start);
        int len = sql.length();
        out.append(quote);
        int i = start + 1;
        while (i < len) {
            char ch = sql.charAt(i);
            out.append(ch);
            if (ch == '\\' && quote != '`' && i + 1 < len) {
                out.append(sql.charAt(i + 1));
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    out.append(quote);
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }
}
