package com.example.gridfill.engine.command;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code <expression> [ASC|DESC]} key of an {@code orderBy} attribute.
 */
@Value
public class SortKey {
    private static final Pattern DIRECTION = Pattern.compile("(?is)^(.*?)\\s+(ASC|DESC)$");

    String expression;
    boolean descending;

    /**
     * Splits {@code a DESC, b} into keys, ignoring commas inside parentheses and quoted strings.
     */
    public static List<SortKey> parseAll(String orderBy) {
        if (orderBy == null) {
            return Collections.emptyList();
        }
        List<SortKey> keys = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < orderBy.length(); i++) {
            char c = orderBy.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                add(keys, orderBy.substring(start, i));
                start = i + 1;
            }
        }
        add(keys, orderBy.substring(start));
        return Collections.unmodifiableList(keys);
    }

    private static void add(List<SortKey> keys, String part) {
        String text = part.trim();
        if (text.isEmpty()) {
            return;
        }
        Matcher matcher = DIRECTION.matcher(text);
        if (matcher.matches()) {
            keys.add(new SortKey(matcher.group(1).trim(), "DESC".equalsIgnoreCase(matcher.group(2))));
        } else {
            keys.add(new SortKey(text, false));
        }
    }
}
