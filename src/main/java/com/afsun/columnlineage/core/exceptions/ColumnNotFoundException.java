package com.afsun.columnlineage.core.exceptions;

import lombok.Getter;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 请求的列/表不存在
 * 附带可选的候选列表
 *
 * @author afsun
 */
@Getter
public class ColumnNotFoundException extends LineageException {

    private static final int MAX_LISTED = 50;

    private final List<String> candidates;

    public ColumnNotFoundException(Collection<String> candidates, String message, Object... args) {
        super("NOT_FOUND", format(message, args) + describe(candidates), "请从候选列表中选择");
        this.candidates = candidates == null ? new ArrayList<>() : new ArrayList<>(candidates);
    }

    private static String format(String message, Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return message;
        }
        return MessageFormatter.arrayFormat(message, args).getMessage();
    }

    private static String describe(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return "，无可用候选";
        }
        List<String> shown = new ArrayList<>(candidates);
        StringBuilder sb = new StringBuilder("，可选: ");
        sb.append(String.join(", ", shown.subList(0, Math.min(MAX_LISTED, shown.size()))));
        if (shown.size() > MAX_LISTED) {
            sb.append(" ... (共").append(shown.size()).append("个)");
        }
        return sb.toString();
    }
}
