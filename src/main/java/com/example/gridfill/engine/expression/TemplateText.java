package com.example.gridfill.engine.expression;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cell text split into literal runs and embedded expressions.
 * An opening marker without a matching closing marker is kept as literal text.
 */
public final class TemplateText {
    private final List<Segment> segments;

    private TemplateText(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static TemplateText parse(String text, Notation notation) {
        List<Segment> segments = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf(notation.getBegin(), pos);
            if (open < 0) {
                break;
            }
            int exprStart = open + notation.getBegin().length();
            int close = findClose(text, exprStart, notation);
            if (close < 0) {
                break;
            }
            if (open > pos) {
                segments.add(new Segment(false, text.substring(pos, open)));
            }
            segments.add(new Segment(true, text.substring(exprStart, close).trim()));
            pos = close + notation.getEnd().length();
        }
        if (pos < text.length()) {
            segments.add(new Segment(false, text.substring(pos)));
        }
        return new TemplateText(segments);
    }

    /**
     * A command attribute as a bare expression: {@code ${employees}} and {@code employees} both give
     * {@code employees}.
     */
    public static String unwrapAttribute(String attribute, Notation notation) {
        String source = attribute.trim();
        if (source.startsWith(notation.getBegin()) && source.endsWith(notation.getEnd())) {
            TemplateText text = parse(source, notation);
            if (text.isSingleExpression()) {
                for (Segment segment : text.segments) {
                    if (segment.isExpression()) {
                        return segment.getText();
                    }
                }
            }
        }
        return source;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public boolean hasExpressions() {
        for (Segment segment : segments) {
            if (segment.isExpression()) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the text is exactly one expression, ignoring surrounding whitespace. Such cells keep the
     * native type of the value instead of being rendered as text.
     */
    public boolean isSingleExpression() {
        int expressions = 0;
        for (Segment segment : segments) {
            if (segment.isExpression()) {
                expressions++;
            } else if (!segment.getText().isBlank()) {
                return false;
            }
        }
        return expressions == 1;
    }

    /**
     * Index of the closing marker, skipping quoted strings and, for a '}' marker, balanced inner braces.
     */
    private static int findClose(String text, int from, Notation notation) {
        String end = notation.getEnd();
        boolean braces = end.charAt(0) == '}';
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (braces && c == '{') {
                depth++;
            } else if (text.startsWith(end, i)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    @Value
    public static class Segment {
        boolean expression;
        String text;
    }
}
